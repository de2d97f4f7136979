package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.Lexeme;
import org.texparse.latex.syntax.PatternComponent;
import org.texparse.latex.syntax.SymbolSyntax;

/**
 * Matched symbol pattern, its parameters as children. A symbol nobody
 * defined is kept as its single character.
 */
public sealed class SymbolToken extends LatexToken permits CommandToken {
    private final SymbolSyntax symbol;
    private final String text;

    public SymbolToken(SymbolSyntax symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol is null");
        }
        this.symbol = symbol;
        this.text = null;
    }

    /** Unrecognized symbol. */
    public SymbolToken(String text) {
        this.symbol = null;
        this.text = text;
    }

    SymbolToken() {
        this.symbol = null;
        this.text = "";
    }

    public Optional<SymbolSyntax> symbol() {
        return Optional.ofNullable(symbol);
    }

    public boolean isRecognized() {
        return symbol != null;
    }

    @Override
    public TokenKind kind() {
        return TokenKind.SYMBOL;
    }

    @Override
    public Optional<Lexeme> lexeme() {
        return symbol == null ? Optional.of(Lexeme.UNKNOWN) : symbol.lexeme();
    }

    @Override
    public String toSource() {
        return patternSource();
    }

    /** The pattern with every parameter replaced by its parsed source. */
    public String patternSource() {
        if (symbol == null) {
            return text;
        }
        var sb = new StringBuilder();
        int child = 0;
        for (PatternComponent component : symbol.components()) {
            if (component instanceof PatternComponent.ParameterSlot) {
                LatexToken parameter = childAt(child++);
                if (parameter != null) {
                    sb.append(parameter.toSource());
                }
            } else {
                sb.append(component);
            }
        }
        return sb.toString();
    }
}
