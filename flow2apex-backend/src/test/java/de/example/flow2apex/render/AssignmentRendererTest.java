package de.example.flow2apex.render;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import de.example.flow2apex.engine.ElementProcessingException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AssignmentRendererTest {
  private final RenderHarness h = new RenderHarness();

  private static String item(String target, String op, String value) {
    return "<assignmentItems>" + (target == null ? "" : "<assignToReference>" + target + "</assignToReference>")
        + "<operator>" + op + "</operator><value>" + value + "</value></assignmentItems>";
  }

  @Test
  public void rendersEachItemWithItsOperator() {
    h.env.declare("Contacts", "List<Contact>");
    String code = h.render(new AssignmentRenderer(), "Set_Values",
        "<assignments><name>Set_Values</name>"
            + item("$Record.Status", "Assign", "<stringValue>Open</stringValue>")
            + item("counter", "Add", "<numberValue>1</numberValue>")
            + item("Contacts", "Add", "<elementReference>newContact</elementReference>")
            + item("total", "Subtract", "<elementReference>$Record.Discount__c</elementReference>")
            + item("queue", "AddAtStart", "<elementReference>first</elementReference>")
            + "</assignments>");

    assertThat(code).isEqualTo(
        "record.Status = 'Open';\n"
            + "counter += 1;\n"
            + "Contacts.add(newContact);\n"
            + "total -= record.Discount__c;\n"
            + "queue.add(0, first);\n");
  }

  @Test
  public void collectionIsRecognisedByNameSuffix() {
    String code = h.render(new AssignmentRenderer(), "Collect",
        "<assignments><name>Collect</name>"
            + item("leadList", "Add", "<elementReference>l</elementReference>")
            + "</assignments>");

    assertThat(code).isEqualTo("leadList.add(l);\n");
    assertThat(AssignmentRenderer.statement("ids", "RemoveFirst", "x", true)).isEqualTo("ids.remove(ids.indexOf(x));");
  }

  @Test
  public void itemWithoutTargetIsReported() {
    String code = h.render(new AssignmentRenderer(), "Partial",
        "<assignments><name>Partial</name>"
            + item(null, "Assign", "<numberValue>1</numberValue>")
            + item("x", "Assign", "<booleanValue>false</booleanValue>")
            + "</assignments>");

    assertThat(code).isEqualTo("// ERROR: Assignment item without assignToReference\nx = false;\n");
  }

  @Test
  public void noItemsIsRecoverableError() {
    ElementProcessingException e = assertThrows(ElementProcessingException.class,
        () -> h.render(new AssignmentRenderer(), "Empty", "<assignments><name>Empty</name></assignments>"));

    assertThat(e.reason()).isEqualTo("No assignment items found");
  }
}
