package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.Lexeme;

/** Root of a whole parsed document. */
public final class DocumentToken extends LatexToken {
    @Override
    public TokenKind kind() {
        return TokenKind.DOCUMENT;
    }

    @Override
    public Optional<Lexeme> lexeme() {
        return Optional.empty();
    }

    @Override
    public String toSource() {
        return childrenSource();
    }
}
