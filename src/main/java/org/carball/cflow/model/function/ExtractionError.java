package org.carball.cflow.model.function;

/**
 * A function-like fragment that could not be delimited.
 */
public record ExtractionError(int index, String name, int offset, String message) {
}
