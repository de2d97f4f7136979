package org.texparse.latex.syntax;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;
import org.texparse.latex.Operation;

/** Command definition: a symbol pattern that follows {@code \name}. */
public final class CommandSyntax extends SymbolSyntax {
    // wider than what \name can invoke: environment names may carry digits
    static final Pattern NAME = Pattern.compile("[\\w@]+\\*?");

    private final String name;

    public CommandSyntax(
        String name,
        String pattern,
        Lexeme lexeme,
        Map<Mode, Boolean> modes,
        List<ParameterSyntax> parameters,
        List<Operation> operations
    ) {
        super(pattern, lexeme, modes, parameters, operations);
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid command name: " + name);
        }
        this.name = name;
    }

    public static CommandSyntax of(String name, String pattern, ParameterSyntax... parameters) {
        return new CommandSyntax(name, pattern, null, null, List.of(parameters), null);
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && name.equals(((CommandSyntax) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), name);
    }

    @Override
    public String toString() {
        return "Command \\" + name + pattern();
    }
}
