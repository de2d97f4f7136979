package org.texparse.latex.syntax;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;
import org.texparse.latex.Operation;

/**
 * Symbol definition. The pattern mixes literal text, blanks and {@code #n}
 * parameter references; operations run once the whole pattern matched.
 */
public class SymbolSyntax extends SyntaxItem {
    private final List<ParameterSyntax> parameters;
    private final List<Operation> operations;
    private final List<PatternComponent> components;

    public SymbolSyntax(
        String pattern,
        Lexeme lexeme,
        Map<Mode, Boolean> modes,
        List<ParameterSyntax> parameters,
        List<Operation> operations
    ) {
        super(lexeme, modes);
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.operations = operations == null ? List.of() : List.copyOf(operations);
        this.components = PatternComponent.parse(pattern == null ? "" : pattern, this.parameters.size());
    }

    public static SymbolSyntax of(String pattern, Lexeme lexeme) {
        return new SymbolSyntax(pattern, lexeme, null, null, null);
    }

    public List<ParameterSyntax> parameters() {
        return parameters;
    }

    public ParameterSyntax parameter(int index) {
        if (index < 0 || index >= parameters.size()) {
            throw new IllegalArgumentException("no parameter " + index);
        }
        return parameters.get(index);
    }

    public List<Operation> operations() {
        return operations;
    }

    public List<PatternComponent> components() {
        return components;
    }

    /** Canonical pattern: blanks collapsed to one space. */
    public String pattern() {
        return components.stream().map(PatternComponent::toString).collect(Collectors.joining());
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        var other = (SymbolSyntax) o;
        return parameters.equals(other.parameters)
            && operations.equals(other.operations)
            && components.equals(other.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), parameters, operations, components);
    }

    @Override
    public String toString() {
        return "Symbol " + pattern();
    }
}
