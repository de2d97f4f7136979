package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.Lexeme;

/** Raw source taken verbatim. */
public final class SourceToken extends LatexToken {
    private final String source;
    private final Lexeme lexeme;

    public SourceToken(String source, Lexeme lexeme) {
        if (source == null) {
            throw new IllegalArgumentException("source is null");
        }
        this.source = source;
        this.lexeme = lexeme == null ? Lexeme.RAW : lexeme;
    }

    public String source() {
        return source;
    }

    @Override
    public TokenKind kind() {
        return TokenKind.SOURCE;
    }

    @Override
    public Optional<Lexeme> lexeme() {
        return Optional.of(lexeme);
    }

    @Override
    public String toSource() {
        return source;
    }
}
