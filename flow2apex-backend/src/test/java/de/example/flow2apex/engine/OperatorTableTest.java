package de.example.flow2apex.engine;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OperatorTableTest {

  @Test
  public void comparisonOperators() {
    assertThat(OperatorTable.format("record.Amount", "GreaterThan", "100")).isEqualTo("record.Amount > 100");
    assertThat(OperatorTable.format("x", "EqualTo", "'A'")).isEqualTo("x == 'A'");
    assertThat(OperatorTable.format("x", "NotEqualTo", "y")).isEqualTo("x != y");
    assertThat(OperatorTable.format("x", "LessThanOrEqualTo", "3")).isEqualTo("x <= 3");
  }

  @Test
  public void nullChecks() {
    assertThat(OperatorTable.format("x", "IsNull", "true")).isEqualTo("x == null");
    assertThat(OperatorTable.format("x", "IsNull", "false")).isEqualTo("x != null");
    assertThat(OperatorTable.format("x", "IsNotNull", "null")).isEqualTo("x != null");
  }

  @Test
  public void changedComparesAgainstPriorRecord() {
    assertThat(OperatorTable.format("record.StageName", "IsChanged", "true"))
        .isEqualTo("record.StageName != oldRecord.StageName");
  }

  @Test
  public void changedWithoutRecordFieldHasNoPriorValue() {
    assertThat(OperatorTable.format("total", "IsChanged", "true"))
        .isEqualTo("false /* ERROR: No prior value for total */");
    assertThat(OperatorTable.priorOf("a.Name")).isEmpty();
    assertThat(OperatorTable.priorOf("record.Name")).hasValue("oldRecord.Name");
  }

  @Test
  public void containmentBecomesMethodCall() {
    assertThat(OperatorTable.format("record.Name", "Contains", "'Acme'")).isEqualTo("record.Name.contains('Acme')");
    assertThat(OperatorTable.format("record.Name", "StartsWith", "'A'")).isEqualTo("record.Name.startsWith('A')");
    assertThat(OperatorTable.format("record.Tags", "Excludes", "'x'")).isEqualTo("!record.Tags.contains('x')");
    assertThat(OperatorTable.format("record", "IsNew", "true")).isEqualTo("record.isNew()");
  }

  @Test
  public void unknownOperatorPassesThrough() {
    assertThat(OperatorTable.symbol("WasSet")).isEqualTo("WasSet");
    assertThat(OperatorTable.format("a", "WasSet", "b")).isEqualTo("a WasSet b");
  }

  @Test
  public void soqlFilters() {
    assertThat(OperatorTable.soql("Name", "Contains", "Acme", null)).isEqualTo("Name LIKE '%Acme%'");
    assertThat(OperatorTable.soql("Id", "EqualTo", null, "record.Id")).isEqualTo("Id = record.Id");
    assertThat(OperatorTable.soql("Active__c", "EqualTo", "True", null)).isEqualTo("Active__c = true");
    assertThat(OperatorTable.soql("StageName", "NotEqualTo", "Closed", null)).isEqualTo("StageName != 'Closed'");
  }
}
