package de.example.flow2apex.render;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import de.example.flow2apex.engine.ElementProcessingException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FormulaRendererTest {
  private final RenderHarness h = new RenderHarness();

  private static String formula(String name, String dataType, String expression) {
    return "<formulas><name>" + name + "</name>"
        + (dataType == null ? "" : "<dataType>" + dataType + "</dataType>")
        + (expression == null ? "" : "<expression>" + expression + "</expression>")
        + "</formulas>";
  }

  @Test
  public void expressionFormulaBecomesGetter() {
    String code = h.render(new FormulaRenderer(), "Discount", formula("Discount", "Number", "{!$Record.Amount} * 0.1"));

    assertThat(code).isEqualTo("private static Decimal getDiscount() {\n    return record.Amount * 0.1;\n}\n\n");
    assertThat(h.env.functionOf("Discount")).hasValue("getDiscount");
    assertThat(h.references.resolve("Discount", "Other")).isEqualTo("getDiscount()");
  }

  @Test
  public void caseFormulaBecomesSwitch() {
    String code = h.render(new FormulaRenderer(), "Score",
        formula("Score", "Number", "CASE({!$Record.Rating}, 'Hot', 3, 'Warm', 2, 0)"));

    assertThat(code).isEqualTo(
        "private static Decimal getScore() {\n"
            + "    switch on record.Rating {\n"
            + "        when 'Hot' { return 3; }\n"
            + "        when 'Warm' { return 2; }\n"
            + "        when else { return 0; }\n"
            + "    }\n"
            + "    return null;\n"
            + "}\n\n");
  }

  @Test
  public void argumentsSplitOnTopLevelCommasOnly() {
    assertThat(FormulaRenderer.splitArguments("a, f(b, c), 'x,y'")).containsExactly("a", "f(b, c)", "'x,y'").inOrder();
  }

  @Test
  public void missingExpressionIsRecoverableError() {
    ElementProcessingException e = assertThrows(ElementProcessingException.class,
        () -> h.render(new FormulaRenderer(), "Broken", formula("Broken", "Text", null)));

    assertThat(e.reason()).isEqualTo("Missing required expression");
    assertThat(h.env.functionOf("Broken")).isEmpty();
  }

  @Test
  public void unbalancedCaseIsRecoverableErrorBeforeAnyOutput() {
    ElementProcessingException e = assertThrows(ElementProcessingException.class,
        () -> h.render(new FormulaRenderer(), "Tier", formula("Tier", "Text", "CASE({!x}, 1, 'a', 'b'")));

    assertThat(e.reason()).isEqualTo("Unbalanced parentheses in CASE expression");
    assertThat(h.env.typeOf("Tier")).isEmpty();
    assertThat(h.out.render()).isEmpty();
  }
}
