package org.carball.cflow.model.function;

import org.carball.cflow.model.token.Token;

import java.util.List;

/**
 * A function definition found in a source file.
 *
 * @param index          discovery order within the file, shared with extraction errors
 * @param name           unqualified function name
 * @param parameters     parameter names in declaration order
 * @param body           tokens strictly between the body braces
 * @param enclosingScope enclosing class/namespace chain joined with {@code ::}, empty for free functions
 * @param offset         source offset of the name token
 */
public record FunctionUnit(
        int index,
        String name,
        List<String> parameters,
        List<Token> body,
        String enclosingScope,
        int offset
) {
    public FunctionUnit {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
        enclosingScope = enclosingScope == null ? "" : enclosingScope;
    }

    public String qualifiedName() {
        return enclosingScope.isEmpty() ? name : enclosingScope + "::" + name;
    }

    public boolean isMember() {
        return !enclosingScope.isEmpty();
    }
}
