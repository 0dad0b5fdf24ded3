package de.example.flow2apex.api;

import static com.google.common.truth.Truth.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import de.example.flow2apex.TranspilerProperties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@RunWith(JUnit4.class)
public class HealthControllerTest {
  private final MockMvc mvc = MockMvcBuilders.standaloneSetup(
      new HealthController("flow2apex-test", new TranspilerProperties(1000, 4))).build();

  @Test
  public void reportsServiceStatus() throws Exception {
    for (String path : new String[] {"/api/health", "/health"}) {
      String body = mvc.perform(get(path)).andExpect(status().isOk()).andReturn().getResponse().getContentAsString();

      assertThat(body).contains("\"status\":\"ok\"");
      assertThat(body).contains("\"service\":\"flow2apex-test\"");
      assertThat(body).contains("\"maxInputLength\":1000");
      assertThat(body).contains("\"indentWidth\":4");
    }
  }
}
