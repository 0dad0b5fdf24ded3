package de.example.flow2apex.model;

import java.util.Optional;

/**
 * One comparison of a decision rule or filter.
 * {@code rightValue} is the raw {@code <rightValue>} node, absent for unary operators.
 */
public record Condition(String leftReference, String operator, Optional<XmlNode> rightValue) {
}
