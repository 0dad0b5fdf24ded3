package de.example.flow2apex.api;

import de.example.flow2apex.engine.FlowTranspileException;
import de.example.flow2apex.parse.FlowParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(FlowParseException.class)
  public ResponseEntity<String> handleParse(FlowParseException e) {
    log.warn("Rejected flow document: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .contentType(MediaType.TEXT_PLAIN)
        .body("Parse error (Flow XML). The body must be a Salesforce Flow metadata document.\n\n" + e.getMessage());
  }

  @ExceptionHandler(FlowTranspileException.class)
  public ResponseEntity<String> handleTranspile(FlowTranspileException e) {
    log.error("Transpile failed at {}: {}", e.elementKind().displayName(), e.getMessage());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .contentType(MediaType.TEXT_PLAIN)
        .body(e.getMessage());
  }
}
