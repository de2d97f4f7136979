package org.texparse.latex.parser;

import org.texparse.parser.SourceLabel;

/**
 * Receives problems found in the input. Parsing always goes on after a
 * report; the context tells where the problem is.
 */
public interface ParserDiagnostics {
    void onUnknownSymbol(LatexContext context, String symbol);

    void onUnknownCommand(LatexContext context, String name);

    void onUnknownEnvironment(LatexContext context, String name);

    /** A group was closed that was never opened. */
    void onUnbalancedGroup(LatexContext context);

    /** {@code \begin{name}} without a matching {@code \end{name}}. */
    void onUnterminatedEnvironment(LatexContext context, String name);

    /** A delimited argument ran to the end of input. */
    void onMissingDelimiter(LatexContext context, SourceLabel label);
}
