package de.example.flow2apex.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import de.example.flow2apex.emit.Scope;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReferenceResolverTest {
  private final LoopContextStack loops = new LoopContextStack();
  private final VariableEnvironment env = new VariableEnvironment();
  private final ReferenceResolver resolver = new ReferenceResolver(loops, env);

  @Test
  public void rewritesRecordScopedReferences() {
    assertThat(resolver.resolve("$Record.Name", "X")).isEqualTo("record.Name");
    assertThat(resolver.resolve("$Record__Prior.StageName", "X")).isEqualTo("oldRecord.StageName");
    assertThat(resolver.resolve("$Flow.CurrentDate", "X")).isEqualTo("Flow.CurrentDate");
    assertThat(resolver.resolve("$Record", "X")).isEqualTo("record");
    assertThat(resolver.resolve("plainVar", "X")).isEqualTo("plainVar");
    assertThat(resolver.resolve("  ", "X")).isEqualTo("unknown");
  }

  @Test
  public void loopReferenceOutsideLoopIsRecoverableError() {
    ElementProcessingException e =
        assertThrows(ElementProcessingException.class, () -> resolver.resolve("$Loop.Name", "Set_Name"));
    assertThat(e.elementName()).isEqualTo("Set_Name");
    assertThat(e).hasMessageThat().contains("$Loop.Name");
  }

  @Test
  public void loopScopedReferencesUseActiveLoopVariable() {
    env.declareLoopVariable("Each_Account", "a");
    try (Scope s = loops.enter(new LoopContext("#3", "a", "Accounts"))) {
      assertThat(resolver.resolve("$Loop.Name", "X")).isEqualTo("a.Name");
      assertThat(resolver.resolve("Accounts", "X")).isEqualTo("a");
      assertThat(resolver.resolve("Accounts.Industry", "X")).isEqualTo("a.Industry");
      assertThat(resolver.resolve("Each_Account.Id", "X")).isEqualTo("a.Id");
      assertThat(resolver.resolve("AccountsArchive", "X")).isEqualTo("AccountsArchive");
    }
    assertThat(resolver.resolve("Accounts", "X")).isEqualTo("Accounts");
  }

  @Test
  public void nestedLoopsConsultInnermostFirst() {
    try (Scope o = loops.enter(new LoopContext("#1", "a", "Accounts"));
         Scope i = loops.enter(new LoopContext("#2", "c", "Contacts"))) {
      assertThat(resolver.resolve("$Loop.Email", "X")).isEqualTo("c.Email");
      assertThat(resolver.resolve("Contacts", "X")).isEqualTo("c");
      assertThat(resolver.resolve("Accounts.Name", "X")).isEqualTo("a.Name");
    }
  }

  @Test
  public void formulaNamesBecomeGetterCalls() {
    env.declareFunction("Discount", "getDiscount");
    assertThat(resolver.forElement("X").resolve("Discount")).isEqualTo("getDiscount()");
  }
}
