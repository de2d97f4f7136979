package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.Lexeme;
import org.texparse.syntax.Token;

/**
 * Token of a parsed LaTeX document. The set of kinds is closed; switch on
 * {@link #kind()} to handle them.
 */
public abstract sealed class LatexToken extends Token<LatexToken>
    permits DocumentToken, SymbolToken, ParameterToken, EnvironmentToken,
            EnvironmentBodyToken, SpaceToken, SourceToken {

    @Override
    protected final LatexToken self() {
        return this;
    }

    public abstract TokenKind kind();

    public abstract Optional<Lexeme> lexeme();

    /** Source text rebuilt from the definition and the children. */
    public abstract String toSource();

    protected String childrenSource() {
        var sb = new StringBuilder();
        for (LatexToken child : children()) {
            sb.append(child.toSource());
        }
        return sb.toString();
    }

    @Override
    protected void appendContent(StringBuilder sb, int maxDepth, int depth) {
        sb.append(toSource());
    }
}
