package de.example.flow2apex.api;

import de.example.flow2apex.FlowTranspiler;
import de.example.flow2apex.TranspilerProperties;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class TranspileController {

  private final FlowTranspiler transpiler;
  private final TranspilerProperties properties;

  public TranspileController(FlowTranspiler transpiler, TranspilerProperties properties) {
    this.transpiler = transpiler;
    this.properties = properties;
  }

  @PostMapping(
      value = {"/transpile", "/transpile/"},
      consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE},
      produces = MediaType.TEXT_PLAIN_VALUE
  )
  public ResponseEntity<String> transpile(@RequestBody(required = false) String input) {
    if (input == null || input.isBlank()) return ResponseEntity.ok("");
    if (input.length() > properties.maxInputLength()) {
      return ResponseEntity.badRequest().body("Input too large (max " + properties.maxInputLength() + " characters).");
    }
    return ResponseEntity.ok(transpiler.transpile(input));
  }
}
