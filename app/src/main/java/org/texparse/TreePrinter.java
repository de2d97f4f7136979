package org.texparse;

import java.util.List;

import org.texparse.latex.tree.CommandToken;
import org.texparse.latex.tree.EnvironmentToken;
import org.texparse.latex.tree.LatexToken;
import org.texparse.latex.tree.ParameterToken;
import org.texparse.latex.tree.SourceToken;
import org.texparse.latex.tree.SpaceToken;
import org.texparse.latex.tree.SymbolToken;

/**
 * Prints a token tree one token per line, indented by depth, with the
 * lexeme, a short description and the line:column span.
 */
class TreePrinter {
    private static final String INDENT = "  ";

    private final StringBuilder sb = new StringBuilder();
    private final List<Integer> lineIndex;
    private int indentLevel = 0;

    TreePrinter(String source) {
        this.lineIndex = SpanUtils.lineIndex(source);
    }

    public String print(LatexToken root) {
        sb.setLength(0);
        indentLevel = 0;
        printToken(root);
        return sb.toString();
    }

    private void printToken(LatexToken token) {
        sb.append(INDENT.repeat(indentLevel)).append(token.kind());
        token.lexeme().ifPresent(lexeme -> sb.append(' ').append(lexeme));
        String details = details(token);
        if (!details.isEmpty()) {
            sb.append(" (").append(details).append(')');
        }
        Integer offset = token.sourceOffset();
        if (offset != null && token.sourceLength() != null) {
            sb.append(" @ ").append(SpanUtils.formatSpan(offset, token.sourceLength(), lineIndex));
        }
        sb.append('\n');

        indentLevel++;
        for (LatexToken child : token.children()) {
            printToken(child);
        }
        indentLevel--;
    }

    private static String details(LatexToken token) {
        return switch (token.kind()) {
            case COMMAND -> "\\" + ((CommandToken) token).name()
                + (((CommandToken) token).isRecognized() ? "" : ", unknown");
            case SYMBOL -> quote(((SymbolToken) token).patternSource())
                + (((SymbolToken) token).isRecognized() ? "" : ", unknown");
            case ENVIRONMENT -> ((EnvironmentToken) token).name()
                + (((EnvironmentToken) token).isTerminated() ? "" : ", unterminated");
            case PARAMETER -> ((ParameterToken) token).hasBrackets() ? "{}" : "";
            case SPACE -> "breaks=" + ((SpaceToken) token).lineBreakCount();
            case SOURCE -> quote(((SourceToken) token).source());
            case DOCUMENT, ENVIRONMENT_BODY -> "";
        };
    }

    private static String quote(String text) {
        return "\"" + text.replace("\n", "\\n") + "\"";
    }
}
