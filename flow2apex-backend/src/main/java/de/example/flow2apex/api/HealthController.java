package de.example.flow2apex.api;

import de.example.flow2apex.TranspilerProperties;

import java.time.Instant;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness plus the limits this instance transpiles with. */
@RestController
@RequestMapping({"/api", ""})
public class HealthController {
  private final String serviceName;
  private final TranspilerProperties properties;

  public HealthController(@Value("${spring.application.name:flow2apex-backend}") String serviceName,
                          TranspilerProperties properties) {
    this.serviceName = serviceName;
    this.properties = properties;
  }

  @GetMapping(value = {"/health", "/health/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Object> health() {
    return Map.of(
        "status", "ok",
        "service", serviceName,
        "maxInputLength", properties.maxInputLength(),
        "indentWidth", properties.indentWidth(),
        "time", Instant.now().toString()
    );
  }
}
