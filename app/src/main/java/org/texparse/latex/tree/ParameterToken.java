package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.Lexeme;
import org.texparse.latex.syntax.ParameterSyntax;

/** Argument of a symbol or command. */
public final class ParameterToken extends LatexToken {
    private final ParameterSyntax parameter;
    private final boolean brackets;
    private final boolean spacePrefix;

    public ParameterToken(ParameterSyntax parameter, boolean brackets, boolean spacePrefix) {
        this.parameter = parameter;
        this.brackets = brackets;
        this.spacePrefix = spacePrefix;
    }

    public Optional<ParameterSyntax> parameter() {
        return Optional.ofNullable(parameter);
    }

    /** Whether the argument was wrapped in braces. */
    public boolean hasBrackets() {
        return brackets;
    }

    public boolean hasSpacePrefix() {
        return spacePrefix;
    }

    @Override
    public TokenKind kind() {
        return TokenKind.PARAMETER;
    }

    @Override
    public Optional<Lexeme> lexeme() {
        return parameter == null ? Optional.empty() : parameter.lexeme();
    }

    @Override
    protected boolean canBeChildOf(LatexToken parent) {
        return parent instanceof SymbolToken;
    }

    @Override
    public String toSource() {
        String inner = childrenSource();
        return (spacePrefix ? " " : "") + (brackets ? "{" + inner + "}" : inner);
    }
}
