package org.carball.cflow.model.token;

/**
 * A character the tokenizer could not classify. Recorded, never fatal.
 */
public record LexicalAnomaly(int offset, char character) {

    public String describe() {
        return String.format("unknown character '%s' (U+%04X) at offset %d",
                character, (int) character, offset);
    }
}
