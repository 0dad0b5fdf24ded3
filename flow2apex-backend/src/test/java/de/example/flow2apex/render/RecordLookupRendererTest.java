package de.example.flow2apex.render;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import de.example.flow2apex.engine.ElementProcessingException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RecordLookupRendererTest {
  private final RenderHarness h = new RenderHarness();

  @Test
  public void firstRecordOnlyLookupSelectsSingleRecord() {
    String code = h.render(new RecordLookupRenderer(), "Get_Account",
        "<recordLookups><name>Get_Account</name><object>Account</object>"
            + "<getFirstRecordOnly>true</getFirstRecordOnly><outputReference>acct</outputReference>"
            + "<queriedFields>Id</queriedFields><queriedFields>Name</queriedFields>"
            + "<filters><field>Id</field><operator>EqualTo</operator>"
            + "<value><elementReference>$Record.AccountId</elementReference></value></filters>"
            + "<filters><field>Name</field><operator>StartsWith</operator>"
            + "<value><stringValue>Acme</stringValue></value></filters>"
            + "</recordLookups>");

    assertThat(code).isEqualTo(
        "Account acct = [\n"
            + "    SELECT Id, Name\n"
            + "    FROM Account\n"
            + "    WHERE Id = record.AccountId AND Name LIKE 'Acme%'\n"
            + "    LIMIT 1\n"
            + "];\n");
    assertThat(h.env.typeOf("acct")).hasValue("Account");
  }

  @Test
  public void collectionLookupDefaultsToIdAndElementName() {
    String code = h.render(new RecordLookupRenderer(), "Open_Cases",
        "<recordLookups><name>Open_Cases</name><object>Case</object></recordLookups>");

    assertThat(code).isEqualTo("List<Case> Open_Cases = [\n    SELECT Id\n    FROM Case\n];\n");
    assertThat(h.env.isList("Open_Cases")).isTrue();
  }

  @Test
  public void outputAssignmentsCopyFields() {
    String code = h.render(new RecordLookupRenderer(), "Get_Owner",
        "<recordLookups><name>Get_Owner</name><object>User</object><getFirstRecordOnly>true</getFirstRecordOnly>"
            + "<outputAssignments><assignToReference>ownerEmail</assignToReference><field>Email</field></outputAssignments>"
            + "</recordLookups>");

    assertThat(code).endsWith("];\nownerEmail = Get_Owner.Email;\n");
  }

  @Test
  public void missingObjectIsRecoverableError() {
    ElementProcessingException e = assertThrows(ElementProcessingException.class,
        () -> h.render(new RecordLookupRenderer(), "Broken", "<recordLookups><name>Broken</name></recordLookups>"));

    assertThat(e.reason()).isEqualTo("Missing required object type");
  }
}
