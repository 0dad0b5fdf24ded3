package de.example.flow2apex.render;

import static com.google.common.truth.Truth.assertThat;
import static de.example.flow2apex.FlowFixtures.assignment;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ScreenRendererTest {
  private final RenderHarness h = new RenderHarness();

  @Test
  public void listsMessagesFieldsAndNavigation() {
    String code = h.render(new ScreenRenderer(), "Contact_Info",
        "<screens><name>Contact_Info</name><label>Contact Information</label>"
            + "<fields><name>Intro</name><fieldType>DisplayText</fieldType>"
            + "<fieldText>&lt;p&gt;Hello {!$User.FirstName}&lt;/p&gt;</fieldText></fields>"
            + "<fields><name>Email</name><fieldType>InputField</fieldType><dataType>Email</dataType>"
            + "<fieldText>Email</fieldText><isRequired>true</isRequired><helpText>Work address</helpText></fields>"
            + "<fields><name>Age</name><fieldType>InputField</fieldType><dataType>Number</dataType>"
            + "<fieldText>Age</fieldText><scale>0</scale></fields>"
            + "<connector><targetReference>Save</targetReference></connector>"
            + "</screens>",
        assignment("Save", null));

    assertThat(code).isEqualTo(
        "// Screen: Contact Information\n"
            + "Screen Contact_Info = new Screen(\n"
            + "    // Message: Hello {$User.FirstName}\n"
            + "    // Email - Email format required - Required\n"
            + "    // Help: Work address\n"
            + "    String Email, // User input field\n"
            + "    // Age - Number - Optional\n"
            + "    // Validation: Scale: 0\n"
            + "    Decimal Age // User input field\n"
            + ");\n"
            + "// Navigation:\n"
            + "//    Next/Finish -> Save (assignments)\n");
  }

  @Test
  public void emptyScreenIsPlainConstructor() {
    String code = h.render(new ScreenRenderer(), "Welcome", "<screens><name>Welcome</name></screens>");

    assertThat(code).isEqualTo("Screen Welcome = new Screen();\n");
  }

  @Test
  public void cleanMessageStripsMarkupAndEntities() {
    assertThat(ScreenRenderer.cleanMessage("&lt;b&gt;Hi&lt;/b&gt;   &amp;\n bye {!name}"))
        .isEqualTo("Hi & bye {name}");
  }
}
