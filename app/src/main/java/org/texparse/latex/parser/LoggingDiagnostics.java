package org.texparse.latex.parser;

import java.text.MessageFormat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.texparse.parser.Position;
import org.texparse.parser.SourceLabel;

/** Default diagnostics: one warning per problem. */
public class LoggingDiagnostics implements ParserDiagnostics {
    private static final Logger log = LogManager.getLogger("diagnostics");

    @Override
    public void onUnknownSymbol(LatexContext context, String symbol) {
        report(context, "Unknown symbol \"{0}\"", symbol);
    }

    @Override
    public void onUnknownCommand(LatexContext context, String name) {
        report(context, "Unknown command \"{0}\"", name);
    }

    @Override
    public void onUnknownEnvironment(LatexContext context, String name) {
        report(context, "Unknown environment \"{0}\"", name);
    }

    @Override
    public void onUnbalancedGroup(LatexContext context) {
        report(context, "Unbalanced group end");
    }

    @Override
    public void onUnterminatedEnvironment(LatexContext context, String name) {
        report(context, "Unterminated environment \"{0}\"", name);
    }

    @Override
    public void onMissingDelimiter(LatexContext context, SourceLabel label) {
        report(context, "Missing \"{0}\"", label.toString());
    }

    protected void report(LatexContext context, String problem, String... arguments) {
        log.warn(format(context, problem, arguments));
    }

    /** {@code problem} with its arguments filled in, followed by the position. */
    public static String format(LatexContext context, String problem, String... arguments) {
        Position position = context.position();
        return MessageFormat.format(problem, (Object[]) arguments)
            + " at line " + position.line() + " char " + position.column();
    }
}
