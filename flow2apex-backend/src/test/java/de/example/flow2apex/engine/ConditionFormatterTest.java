package de.example.flow2apex.engine;

import static com.google.common.truth.Truth.assertThat;
import static de.example.flow2apex.FlowFixtures.*;

import de.example.flow2apex.model.DecisionRule;
import de.example.flow2apex.model.FlowDocument;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConditionFormatterTest {
  private final ReferenceResolver references = new ReferenceResolver(new LoopContextStack(), new VariableEnvironment());

  @Test
  public void joinsByAndOrOr() {
    List<String> parts = List.of("a", "b");
    assertThat(ConditionFormatter.join(parts, "and")).isEqualTo("a && b");
    assertThat(ConditionFormatter.join(parts, "OR")).isEqualTo("a || b");
    assertThat(ConditionFormatter.join(parts, null)).isEqualTo("a && b");
    assertThat(ConditionFormatter.join(List.of("a"), "or")).isEqualTo("a");
    assertThat(ConditionFormatter.join(List.of(), "and")).isEqualTo("true");
  }

  @Test
  public void customLogicSubstitutesNumberedConditions() {
    List<String> parts = List.of("a", "b", "c");
    assertThat(ConditionFormatter.join(parts, "1 AND (2 OR 3)")).isEqualTo("(a) && ((b) || (c))");
    assertThat(ConditionFormatter.join(parts, "1 OR NOT 3")).isEqualTo("(a) || !(c)");
  }

  @Test
  public void outOfRangeConditionNumberBecomesPlaceholder() {
    List<String> parts = List.of("a", "b");
    assertThat(ConditionFormatter.join(parts, "1 OR 99999999999")).isEqualTo("(a) || /* unknown condition 99999999999 */");
    assertThat(ConditionFormatter.join(parts, "1 AND 3")).isEqualTo("(a) && /* unknown condition 3 */");
  }

  @Test
  public void formatsRuleConditionsFromXml() {
    FlowDocument doc = parse(start("Account", "D"), decision("D", null,
        "<rules><name>R</name><conditionLogic>or</conditionLogic>"
            + "<conditions><leftValueReference>$Record.Rating</leftValueReference><operator>EqualTo</operator>"
            + "<rightValue><stringValue>Hot</stringValue></rightValue></conditions>"
            + "<conditions><leftValueReference>$Record.Phone</leftValueReference><operator>IsNull</operator>"
            + "<rightValue><booleanValue>False</booleanValue></rightValue></conditions>"
            + "<label>R</label></rules>"));
    DecisionRule rule = doc.elements().find("D").get().rules().get(0);

    String text = ConditionFormatter.formatAll(rule.conditions(), rule.conditionLogic(), references.forElement("D"));

    assertThat(text).isEqualTo("record.Rating == 'Hot' || record.Phone != null");
  }
}
