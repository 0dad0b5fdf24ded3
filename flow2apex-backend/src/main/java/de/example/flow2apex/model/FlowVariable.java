package de.example.flow2apex.model;

import java.util.Optional;

public record FlowVariable(String name, String dataType, boolean isCollection, Optional<String> objectType) {
}
