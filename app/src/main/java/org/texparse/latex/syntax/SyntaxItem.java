package org.texparse.latex.syntax;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;
import org.texparse.latex.ModeState;

/** Common part of every definition: what it means and where it applies. */
public abstract class SyntaxItem {
    private final Lexeme lexeme;
    private final Map<Mode, Boolean> modes;

    protected SyntaxItem(Lexeme lexeme, Map<Mode, Boolean> modes) {
        this.lexeme = lexeme;
        var copy = new EnumMap<Mode, Boolean>(Mode.class);
        if (modes != null) {
            for (var entry : modes.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw new IllegalArgumentException("mode requirements must not contain nulls");
                }
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        this.modes = Collections.unmodifiableMap(copy);
    }

    public Optional<Lexeme> lexeme() {
        return Optional.ofNullable(lexeme);
    }

    /** Required mode values; modes not listed are unconstrained. */
    public Map<Mode, Boolean> modes() {
        return modes;
    }

    public boolean appliesTo(ModeState state) {
        return state.test(modes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var other = (SyntaxItem) o;
        return lexeme == other.lexeme && modes.equals(other.modes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lexeme, modes);
    }
}
