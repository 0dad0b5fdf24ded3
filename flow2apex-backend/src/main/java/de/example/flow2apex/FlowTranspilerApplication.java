package de.example.flow2apex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FlowTranspilerApplication {

  public static void main(String[] args) {
    SpringApplication.run(FlowTranspilerApplication.class, args);
  }
}
