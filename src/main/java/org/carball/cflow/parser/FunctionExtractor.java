package org.carball.cflow.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.model.function.ExtractionError;
import org.carball.cflow.model.function.ExtractionResult;
import org.carball.cflow.model.function.FunctionUnit;
import org.carball.cflow.model.token.Token;
import org.carball.cflow.model.token.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Finds function definitions in a token stream.
 * <p>
 * Brace depth is tracked with a stack of scopes: {@code class}, {@code struct},
 * {@code union} and {@code namespace} push a named scope, any other brace pushes an
 * anonymous one. A definition is a name followed by a parenthesised parameter list
 * and a body; the first top-level {@code {} after the parameter list is always taken
 * as the body start. Declarations without a body are skipped.
 */
@Slf4j
public class FunctionExtractor {

    private static final Set<String> SCOPE_KEYWORDS = Set.of("class", "struct", "union", "namespace");

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "case", "return", "goto", "break", "continue");

    public ExtractionResult extract(List<Token> tokens) {
        ExtractionResult result = new Scan(tokens).run();
        log.debug("Extracted {} functions and {} extraction errors",
                result.units().size(), result.errors().size());
        return result;
    }

    private static final class Scan {

        private final List<Token> tokens;
        private final Deque<String> scopes = new ArrayDeque<>();
        private final List<FunctionUnit> units = new ArrayList<>();
        private final List<ExtractionError> errors = new ArrayList<>();
        private int index;

        private Scan(List<Token> tokens) {
            this.tokens = tokens;
        }

        ExtractionResult run() {
            int i = 0;
            while (i < tokens.size()) {
                i = step(i);
            }
            return new ExtractionResult(units, errors);
        }

        private int step(int i) {
            Token token = tokens.get(i);
            if (token.isPunctuation("{")) {
                scopes.push("");
                return i + 1;
            }
            if (token.isPunctuation("}")) {
                if (!scopes.isEmpty()) {
                    scopes.pop();
                }
                return i + 1;
            }
            if (token.kind() == TokenKind.KEYWORD && SCOPE_KEYWORDS.contains(token.text())) {
                return openScope(i);
            }
            if (token.isKeyword("enum")) {
                return skipEnum(i);
            }
            if (isCandidate(i)) {
                return extractCandidate(i);
            }
            return i + 1;
        }

        private int openScope(int i) {
            boolean namespace = tokens.get(i).isKeyword("namespace");
            String name = "";
            boolean seenColon = false;
            int angleDepth = 0;

            for (int j = i + 1; j < tokens.size(); j++) {
                Token t = tokens.get(j);
                if (t.isPunctuation("{")) {
                    scopes.push(name);
                    return j + 1;
                }
                if (t.isPunctuation(";") || t.isPunctuation("(") || t.isPunctuation(")")
                        || t.isPunctuation("=") || t.isPunctuation("}")) {
                    return i + 1;
                }
                if (t.isPunctuation("<")) {
                    angleDepth++;
                } else if (t.isPunctuation(">") || t.isPunctuation(">>")) {
                    if (angleDepth == 0 && !seenColon) {
                        // template parameter such as "template <class T>"
                        return i + 1;
                    }
                    angleDepth = Math.max(0, angleDepth - t.text().length());
                } else if (t.isPunctuation(",") && angleDepth == 0 && !seenColon) {
                    return i + 1;
                } else if (t.isPunctuation(":")) {
                    seenColon = true;
                } else if (t.isIdentifier() && !seenColon) {
                    if (name.isEmpty()) {
                        name = t.text();
                    } else if (namespace && tokens.get(j - 1).isPunctuation("::")) {
                        name = name + "::" + t.text();
                    }
                }
            }
            return i + 1;
        }

        private int skipEnum(int i) {
            for (int j = i + 1; j < tokens.size(); j++) {
                Token t = tokens.get(j);
                if (t.isPunctuation("{")) {
                    int end = matching(j, "{", "}");
                    return end < 0 ? tokens.size() : end + 1;
                }
                if (t.isPunctuation(";") || t.isPunctuation("(") || t.isPunctuation("=")) {
                    return i + 1;
                }
            }
            return i + 1;
        }

        private boolean isCandidate(int i) {
            Token token = tokens.get(i);
            boolean named = token.isIdentifier() && i + 1 < tokens.size() && tokens.get(i + 1).isPunctuation("(");
            boolean operator = token.isKeyword("operator");
            if (!named && !operator) {
                return false;
            }
            if (i == 0) {
                return true;
            }
            Token previous = tokens.get(i - 1);
            return !previous.isPunctuation(".") && !previous.isPunctuation("->") && !previous.isKeyword("new");
        }

        private int extractCandidate(int i) {
            Token nameToken = tokens.get(i);
            int open;
            String name;

            if (nameToken.isKeyword("operator")) {
                open = operatorParameterList(i);
                if (open < 0) {
                    return i + 1;
                }
                StringBuilder symbol = new StringBuilder("operator");
                for (int j = i + 1; j < open; j++) {
                    symbol.append(tokens.get(j).text());
                }
                name = symbol.toString();
            } else {
                open = i + 1;
                name = nameToken.text();
            }

            int nameStart = i;
            if (i > 0 && tokens.get(i - 1).isPunctuation("~")) {
                name = "~" + name;
                nameStart = i - 1;
            }
            String qualifier = qualifierBefore(nameStart);
            String scope = enclosingScope(qualifier);

            int close = matching(open, "(", ")");
            if (close < 0) {
                recordError(name, scope, nameToken, "unmatched '(' in parameter list");
                return open + 1;
            }

            int bodyStart = findBodyStart(close + 1);
            if (bodyStart < 0) {
                return close + 1;
            }

            int bodyEnd = matching(bodyStart, "{", "}");
            if (bodyEnd < 0) {
                recordError(name, scope, nameToken, "unterminated function body");
                return bodyStart;
            }

            FunctionUnit unit = new FunctionUnit(
                    index++,
                    name,
                    parameterNames(open, close),
                    tokens.subList(bodyStart + 1, bodyEnd),
                    scope,
                    nameToken.offset());
            units.add(unit);
            log.trace("Found function {} with {} body tokens", unit.qualifiedName(), unit.body().size());
            return bodyEnd + 1;
        }

        private int operatorParameterList(int i) {
            if (i + 2 < tokens.size() && tokens.get(i + 1).isPunctuation("(") && tokens.get(i + 2).isPunctuation(")")) {
                return i + 3 < tokens.size() && tokens.get(i + 3).isPunctuation("(") ? i + 3 : -1;
            }
            for (int j = i + 1; j < tokens.size() && j <= i + 4; j++) {
                if (tokens.get(j).isPunctuation("(")) {
                    return j;
                }
            }
            return -1;
        }

        /**
         * Scans the qualifiers between the parameter list and the body.
         * Returns the index of the body brace, or -1 when the candidate is not a definition.
         */
        private int findBodyStart(int from) {
            boolean initializerList = false;
            int k = from;
            while (k < tokens.size()) {
                Token t = tokens.get(k);
                if (t.isPunctuation("{")) {
                    return k;
                }
                if (t.isPunctuation(";") || t.isPunctuation("=") || t.isPunctuation("}")) {
                    return -1;
                }
                if (t.kind() == TokenKind.KEYWORD && STATEMENT_KEYWORDS.contains(t.text())) {
                    return -1;
                }
                if (t.isPunctuation(":")) {
                    initializerList = true;
                } else if (t.isIdentifier() && !initializerList
                        && k + 1 < tokens.size() && tokens.get(k + 1).isPunctuation("(")) {
                    // another call-like name: this candidate was a macro invocation
                    return -1;
                }
                if (t.isPunctuation("(")) {
                    int end = matching(k, "(", ")");
                    if (end < 0) {
                        return -1;
                    }
                    k = end + 1;
                    continue;
                }
                k++;
            }
            return -1;
        }

        private String qualifierBefore(int nameStart) {
            List<String> parts = new ArrayList<>();
            int j = nameStart - 1;
            while (j >= 1 && tokens.get(j).isPunctuation("::") && tokens.get(j - 1).isIdentifier()) {
                parts.add(0, tokens.get(j - 1).text());
                j -= 2;
            }
            return String.join("::", parts);
        }

        private String enclosingScope(String qualifier) {
            StringJoiner joiner = new StringJoiner("::");
            Iterator<String> outermostFirst = scopes.descendingIterator();
            while (outermostFirst.hasNext()) {
                String scope = outermostFirst.next();
                if (!scope.isEmpty()) {
                    joiner.add(scope);
                }
            }
            if (!qualifier.isEmpty()) {
                joiner.add(qualifier);
            }
            return joiner.toString();
        }

        private void recordError(String name, String scope, Token at, String message) {
            String qualified = scope.isEmpty() ? name : scope + "::" + name;
            ExtractionError error = new ExtractionError(index++, qualified, at.offset(), message);
            errors.add(error);
            log.warn("Could not extract function {} at offset {}: {}", qualified, at.offset(), message);
        }

        private List<String> parameterNames(int open, int close) {
            List<String> names = new ArrayList<>();
            List<Token> segment = new ArrayList<>();
            int depth = 0;
            int angleDepth = 0;

            for (int k = open + 1; k < close; k++) {
                Token t = tokens.get(k);
                if (t.isPunctuation("(") || t.isPunctuation("[") || t.isPunctuation("{")) {
                    depth++;
                } else if (t.isPunctuation(")") || t.isPunctuation("]") || t.isPunctuation("}")) {
                    depth--;
                } else if (depth == 0 && t.isPunctuation("<")) {
                    angleDepth++;
                } else if (depth == 0 && (t.isPunctuation(">") || t.isPunctuation(">>"))) {
                    angleDepth = Math.max(0, angleDepth - t.text().length());
                } else if (depth == 0 && angleDepth == 0 && t.isPunctuation(",")) {
                    addParameterName(names, segment);
                    segment.clear();
                    continue;
                }
                segment.add(t);
            }
            addParameterName(names, segment);
            return names;
        }

        private static void addParameterName(List<String> names, List<Token> segment) {
            String candidate = null;
            int depth = 0;
            for (Token t : segment) {
                if (depth == 0 && (t.isPunctuation("=") || t.isPunctuation("["))) {
                    break;
                }
                if (t.isPunctuation("(")) {
                    depth++;
                } else if (t.isPunctuation(")")) {
                    depth--;
                } else if (depth == 0 && t.isIdentifier()) {
                    candidate = t.text();
                }
            }
            if (candidate == null) {
                candidate = functionPointerName(segment);
            }
            if (candidate != null) {
                names.add(candidate);
            }
        }

        private static String functionPointerName(List<Token> segment) {
            for (int k = 0; k + 2 < segment.size(); k++) {
                if (segment.get(k).isPunctuation("(") && segment.get(k + 1).isPunctuation("*")
                        && segment.get(k + 2).isIdentifier()) {
                    return segment.get(k + 2).text();
                }
            }
            return null;
        }

        private int matching(int openIndex, String open, String close) {
            int depth = 0;
            for (int k = openIndex; k < tokens.size(); k++) {
                Token t = tokens.get(k);
                if (t.isPunctuation(open)) {
                    depth++;
                } else if (t.isPunctuation(close)) {
                    depth--;
                    if (depth == 0) {
                        return k;
                    }
                }
            }
            return -1;
        }
    }
}
