package org.carball.cflow.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.model.token.LexicalAnomaly;
import org.carball.cflow.model.token.Token;
import org.carball.cflow.model.token.TokenKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Splits C-family source text into tokens.
 * <p>
 * Whitespace, comments and preprocessor lines are skipped. Characters that fit no
 * token class are emitted as {@link TokenKind#UNKNOWN} and recorded as
 * {@link LexicalAnomaly anomalies}; the tokenizer never fails on malformed input.
 * Iteration is lazy, each call to {@link #iterator()} starts a fresh pass.
 */
@Slf4j
public class Tokenizer implements Iterable<Token> {

    static final Set<String> KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
            "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
            "_Bool", "_Static_assert", "_Thread_local",
            "alignas", "alignof", "bool", "catch", "class", "constexpr", "const_cast",
            "decltype", "delete", "dynamic_cast", "explicit", "export", "false", "friend",
            "mutable", "namespace", "new", "noexcept", "nullptr", "operator", "private",
            "protected", "public", "reinterpret_cast", "static_assert", "static_cast",
            "template", "this", "thread_local", "throw", "true", "try", "typeid",
            "typename", "using", "virtual", "override", "final"
    );

    // Longest first so that "<<=" wins over "<<"
    private static final String[] OPERATORS = {
            "->*", "<<=", ">>=", "...",
            "&&", "||", "::", "->", "==", "!=", "<=", ">=", "++", "--", "<<", ">>",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", ".*"
    };

    private static final String SINGLE_PUNCTUATION = "{}()[];,.:?~!+-*/%<>=&|^";

    private final String source;
    private final List<LexicalAnomaly> anomalies = new ArrayList<>();

    public Tokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    @Override
    public Iterator<Token> iterator() {
        anomalies.clear();
        return new TokenIterator();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        if (!anomalies.isEmpty()) {
            log.debug("Tokenized {} tokens with {} lexical anomalies", tokens.size(), anomalies.size());
        }
        return tokens;
    }

    /**
     * Anomalies seen by the most recent pass over the source.
     */
    public List<LexicalAnomaly> anomalies() {
        return List.copyOf(anomalies);
    }

    private final class TokenIterator implements Iterator<Token> {

        private int pos;
        private boolean atLineStart = true;
        private Token next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = scan();
            }
            return next != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token token = next;
            next = null;
            return token;
        }

        private Token scan() {
            int length = source.length();
            while (pos < length) {
                char c = source.charAt(pos);

                if (c == '\n') {
                    atLineStart = true;
                    pos++;
                    continue;
                }
                if (Character.isWhitespace(c)) {
                    pos++;
                    continue;
                }
                if (c == '/' && peek(1) == '/') {
                    skipLineComment();
                    continue;
                }
                if (c == '/' && peek(1) == '*') {
                    skipBlockComment();
                    continue;
                }
                if (c == '#' && atLineStart) {
                    skipDirective();
                    continue;
                }

                atLineStart = false;
                int start = pos;

                if (isIdentifierStart(c)) {
                    while (pos < length && isIdentifierPart(source.charAt(pos))) {
                        pos++;
                    }
                    String word = source.substring(start, pos);
                    TokenKind kind = KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
                    return new Token(kind, word, start);
                }
                if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                    scanNumber(start);
                    return new Token(TokenKind.LITERAL, source.substring(start, pos), start);
                }
                if (c == '"' || c == '\'') {
                    scanQuoted(c);
                    return new Token(TokenKind.LITERAL, source.substring(start, pos), start);
                }
                for (String operator : OPERATORS) {
                    if (source.startsWith(operator, pos)) {
                        pos += operator.length();
                        return new Token(TokenKind.PUNCTUATION, operator, start);
                    }
                }
                if (SINGLE_PUNCTUATION.indexOf(c) >= 0) {
                    pos++;
                    return new Token(TokenKind.PUNCTUATION, String.valueOf(c), start);
                }

                pos++;
                LexicalAnomaly anomaly = new LexicalAnomaly(start, c);
                anomalies.add(anomaly);
                log.trace("Lexical anomaly: {}", anomaly.describe());
                return new Token(TokenKind.UNKNOWN, String.valueOf(c), start);
            }
            return null;
        }

        private char peek(int ahead) {
            int index = pos + ahead;
            return index < source.length() ? source.charAt(index) : '\0';
        }

        private void skipLineComment() {
            while (pos < source.length() && source.charAt(pos) != '\n') {
                pos++;
            }
        }

        private void skipBlockComment() {
            int end = source.indexOf("*/", pos + 2);
            pos = end < 0 ? source.length() : end + 2;
        }

        private void skipDirective() {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '\n' && !continuesLine()) {
                    return;
                }
                pos++;
            }
        }

        private boolean continuesLine() {
            int back = pos - 1;
            if (back >= 0 && source.charAt(back) == '\r') {
                back--;
            }
            return back >= 0 && source.charAt(back) == '\\';
        }

        private void scanNumber(int start) {
            int length = source.length();
            boolean hex = source.startsWith("0x", start) || source.startsWith("0X", start);
            while (pos < length) {
                char c = source.charAt(pos);
                if (Character.isLetterOrDigit(c) || c == '.' || c == '_') {
                    pos++;
                } else if ((c == '+' || c == '-') && isExponentMarker(source.charAt(pos - 1), hex)) {
                    pos++;
                } else if (c == '\'' && Character.isLetterOrDigit(peek(1))) {
                    pos++;
                } else {
                    return;
                }
            }
        }

        private boolean isExponentMarker(char c, boolean hex) {
            return hex ? (c == 'p' || c == 'P') : (c == 'e' || c == 'E');
        }

        private void scanQuoted(char quote) {
            int length = source.length();
            pos++;
            while (pos < length) {
                char c = source.charAt(pos);
                if (c == '\\') {
                    pos = Math.min(pos + 2, length);
                } else if (c == quote) {
                    pos++;
                    return;
                } else if (c == '\n') {
                    return;
                } else {
                    pos++;
                }
            }
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
