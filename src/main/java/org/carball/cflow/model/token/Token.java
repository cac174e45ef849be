package org.carball.cflow.model.token;

/**
 * A lexical token of C-family source text.
 *
 * @param kind   token category
 * @param text   literal source text of the token
 * @param offset character offset of the first character in the source
 */
public record Token(TokenKind kind, String text, int offset) {

    public boolean is(String expected) {
        return text.equals(expected);
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && text.equals(keyword);
    }

    public boolean isPunctuation(String punctuation) {
        return kind == TokenKind.PUNCTUATION && text.equals(punctuation);
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }
}
