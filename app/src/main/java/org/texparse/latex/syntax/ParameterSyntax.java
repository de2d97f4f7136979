package org.texparse.latex.syntax;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;
import org.texparse.latex.Operation;

/**
 * Parameter of a symbol or command. Its operations run before the
 * parameter is parsed. With a lexeme, the parameter is taken as one raw
 * source fragment of that lexeme.
 */
public final class ParameterSyntax extends SyntaxItem {
    private final List<Operation> operations;

    public ParameterSyntax(Lexeme lexeme, Map<Mode, Boolean> modes, List<Operation> operations) {
        super(lexeme, modes);
        this.operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public static ParameterSyntax plain() {
        return new ParameterSyntax(null, null, null);
    }

    public static ParameterSyntax raw(Lexeme lexeme) {
        return new ParameterSyntax(lexeme, null, null);
    }

    public List<Operation> operations() {
        return operations;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && operations.equals(((ParameterSyntax) o).operations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), operations);
    }
}
