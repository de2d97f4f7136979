package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.Lexeme;

/** Run of blanks; two or more line breaks make a paragraph separator. */
public final class SpaceToken extends LatexToken {
    private final int lineBreakCount;

    public SpaceToken(int lineBreakCount) {
        if (lineBreakCount < 0) {
            throw new IllegalArgumentException("negative line break count");
        }
        this.lineBreakCount = lineBreakCount;
    }

    public int lineBreakCount() {
        return lineBreakCount;
    }

    public boolean isParagraphSeparator() {
        return lineBreakCount > 1;
    }

    @Override
    public TokenKind kind() {
        return TokenKind.SPACE;
    }

    @Override
    public Optional<Lexeme> lexeme() {
        return Optional.of(isParagraphSeparator() ? Lexeme.PARAGRAPH_SEPARATOR : Lexeme.SPACE);
    }

    @Override
    public String toSource() {
        return switch (lineBreakCount) {
            case 0 -> " ";
            case 1 -> "\n";
            default -> "\n\n";
        };
    }
}
