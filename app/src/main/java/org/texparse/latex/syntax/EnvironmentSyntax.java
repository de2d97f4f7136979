package org.texparse.latex.syntax;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;

/**
 * Environment definition. Its begin and end markers are parsed as the
 * commands {@code name} and {@code endname}.
 */
public final class EnvironmentSyntax extends SyntaxItem {
    static final Pattern NAME = Pattern.compile("[\\w@]+\\*?");

    private final String name;

    public EnvironmentSyntax(String name, Lexeme lexeme, Map<Mode, Boolean> modes) {
        super(lexeme, modes);
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid environment name: " + name);
        }
        this.name = name;
    }

    public static EnvironmentSyntax of(String name) {
        return new EnvironmentSyntax(name, null, null);
    }

    public String name() {
        return name;
    }

    public String beginCommandName() {
        return name;
    }

    public String endCommandName() {
        return "end" + name;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && name.equals(((EnvironmentSyntax) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), name);
    }

    @Override
    public String toString() {
        return "Environment " + name;
    }
}
