package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.Lexeme;

public final class EnvironmentBodyToken extends LatexToken {
    @Override
    public TokenKind kind() {
        return TokenKind.ENVIRONMENT_BODY;
    }

    @Override
    public Optional<Lexeme> lexeme() {
        return Optional.empty();
    }

    @Override
    protected boolean canBeChildOf(LatexToken parent) {
        return parent instanceof EnvironmentToken;
    }

    @Override
    public String toSource() {
        return childrenSource();
    }
}
