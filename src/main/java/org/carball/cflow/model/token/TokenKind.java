package org.carball.cflow.model.token;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    PUNCTUATION,
    LITERAL,
    COMMENT,
    UNKNOWN
}
