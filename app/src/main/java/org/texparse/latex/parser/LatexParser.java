package org.texparse.latex.parser;

import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.texparse.latex.syntax.CommandSyntax;
import org.texparse.latex.syntax.EnvironmentSyntax;
import org.texparse.latex.syntax.ParameterSyntax;
import org.texparse.latex.syntax.PatternComponent;
import org.texparse.latex.syntax.SymbolSyntax;
import org.texparse.latex.syntax.SyntaxRegistry;
import org.texparse.latex.tree.CommandToken;
import org.texparse.latex.tree.DocumentToken;
import org.texparse.latex.tree.EnvironmentBodyToken;
import org.texparse.latex.tree.EnvironmentToken;
import org.texparse.latex.tree.LatexToken;
import org.texparse.latex.tree.ParameterToken;
import org.texparse.latex.tree.SourceToken;
import org.texparse.latex.tree.SpaceToken;
import org.texparse.latex.tree.SymbolToken;
import org.texparse.parser.Parser;
import org.texparse.parser.SourceLabel;
import org.texparse.syntax.SyntaxTree;

/**
 * LaTeX parser. Looks at the context to pick the next step, matches
 * definitions from the registry and backtracks by restoring context copies.
 */
public class LatexParser extends Parser<LatexToken, LatexContext> {
    private static final Logger log = LogManager.getLogger("parser");

    private static final Pattern COMMENT = Pattern.compile("%([^\\n]*)(\\n[ \\t]*)?");
    private static final Pattern COMMAND_START = Pattern.compile("\\\\[A-Za-z@]");
    private static final Pattern COMMAND_NAME = Pattern.compile("\\\\([A-Za-z@]+\\*?)");
    private static final Pattern ENVIRONMENT_START =
        Pattern.compile("\\\\begin(?:\\s|%[^\\n]*\\n)*\\{[A-Za-z@]+\\*?\\}");
    private static final Pattern ENVIRONMENT_NAME = Pattern.compile("\\{([\\w@]+\\*?)\\}");
    private static final Pattern ENVIRONMENT_END = Pattern.compile("\\\\end(?:\\{|\\s|%)");

    private final SyntaxRegistry registry;
    private final ParserDiagnostics diagnostics;

    public LatexParser(SyntaxRegistry registry) {
        this(registry, new LoggingDiagnostics());
    }

    public LatexParser(SyntaxRegistry registry, ParserDiagnostics diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    @Override
    public LatexContext createContext(String source) {
        return new LatexContext(source);
    }

    /** Parses the whole source under a document root spanning all of it. */
    public SyntaxTree<LatexToken> parseTree(String source) {
        LatexContext context = createContext(source);
        var root = new DocumentToken();
        context.setCurrentToken(root);
        parse(context);
        root.setSourceShift(0);
        root.setSourceLength(source.length());
        return new SyntaxTree<>(source, root);
    }

    /* Dispatch */

    @Override
    protected void skipIgnored(LatexContext context) {
        while (parseCommentLine(context) != null) {
            // skipped
        }
    }

    /** Next step at the cursor, or null when this level is done. Skips comments. */
    public ParseStep nextStep(LatexContext context) {
        skipIgnored(context);
        if (context.commandName().isPresent()) {
            return ParseStep.COMMAND;
        }
        if (context.isAtEnd()) {
            return null;
        }
        if (context.parameter().isPresent()) {
            return ParseStep.PARAMETER;
        }
        if (context.stopLabel().isPresent()) {
            return ParseStep.SOURCE;
        }
        if (context.environmentName().isPresent()) {
            return ParseStep.ENVIRONMENT_BODY;
        }
        if (context.probe(ENVIRONMENT_START, false)) {
            return ParseStep.ENVIRONMENT;
        }
        if (context.probe(COMMAND_START, false)) {
            return ParseStep.COMMAND;
        }
        return ParseStep.SYMBOL;
    }

    @Override
    protected TokenParser<LatexToken, LatexContext> tokenParser(LatexContext context) {
        ParseStep step = nextStep(context);
        if (step == null) {
            return null;
        }
        log.debug("step " + step + " at " + context.offset());
        return switch (step) {
            case COMMAND -> this::parseCommandToken;
            case PARAMETER -> this::parseParameterToken;
            case SOURCE -> this::parseSourceToken;
            case ENVIRONMENT_BODY -> this::parseEnvironmentBodyToken;
            case ENVIRONMENT -> this::parseEnvironmentToken;
            case SYMBOL -> this::parseSymbolToken;
        };
    }

    /* Steps */

    LatexToken parseSymbolToken(LatexContext context) {
        String current = context.currentChar();
        SymbolToken token = parsePatterns(context, registry.symbolsFor(context.state(), current));
        if (token != null) {
            return token;
        }
        SpaceToken space = parseSpaceToken(context);
        if (space != null) {
            return space;
        }
        diagnostics.onUnknownSymbol(context, current);
        context.advance(current.length());
        return new SymbolToken(current);
    }

    CommandToken parseCommandToken(LatexContext context) {
        LatexContext before = context.copy();
        LatexContext.PendingCommand pending = context.takeCommand();
        String name;
        boolean implicit = false;
        if (pending == null) {
            Optional<MatchResult> match = context.match(COMMAND_NAME);
            if (match.isEmpty()) {
                return null;
            }
            name = match.get().group(1);
            context.moveTo(match.get().end());
        } else {
            name = pending.name();
            implicit = pending.implicit();
        }

        var token = (CommandToken) parsePatterns(context, registry.commandsFor(context.state(), name));
        if (token == null) {
            if (!implicit) {
                diagnostics.onUnknownCommand(before, name);
            }
            token = new CommandToken(name);
        }
        return token;
    }

    ParameterToken parseParameterToken(LatexContext context) {
        ParameterSyntax parameter = context.takeParameter();
        if (!context.updateState(parameter.operations())) {
            diagnostics.onUnbalancedGroup(context);
        }

        ParameterToken token;
        if (context.stopLabel().isPresent()) {
            // delimited by the pattern itself
            token = new ParameterToken(parameter, false, false);
        } else {
            boolean spacePrefix = parseSpaceToken(context) != null;
            boolean brackets = context.probe("{", true);
            token = new ParameterToken(parameter, brackets, spacePrefix);
            if (brackets) {
                context.setStopLabel(SourceLabel.literal("}"));
            }
        }
        context.setCurrentToken(token);

        Optional<SourceLabel> label = context.stopLabel();
        if (label.isEmpty()) {
            parseToken(context);
            return token;
        }
        if (parameter.lexeme().isPresent()) {
            context.setLexeme(parameter.lexeme().get());
            parseToken(context);
        } else {
            parse(context);
        }
        // left over when the input ended first
        context.takeStopLabel();
        context.takeLexeme();
        if (!context.probe(label.get(), true)) {
            diagnostics.onMissingDelimiter(context, label.get());
        }
        return token;
    }

    SourceToken parseSourceToken(LatexContext context) {
        SourceLabel label = context.takeStopLabel().orElseThrow();
        String source = context.source();
        int end = label.indexIn(source, context.offset());
        if (end < 0) {
            end = source.length();
        }
        String text = source.substring(context.offset(), end);
        context.moveTo(end);
        return new SourceToken(text, context.takeLexeme());
    }

    EnvironmentToken parseEnvironmentToken(LatexContext context) {
        LatexContext before = context.copy();
        if (!context.probe("\\begin", true)) {
            return null;
        }
        parseSpaceToken(context);
        Optional<MatchResult> match = context.match(ENVIRONMENT_NAME);
        if (match.isEmpty()) {
            return null;
        }
        String name = match.get().group(1);

        List<EnvironmentSyntax> candidates = registry.environmentsFor(context.state(), name);
        EnvironmentToken token;
        if (candidates.isEmpty()) {
            diagnostics.onUnknownEnvironment(before, name);
            token = new EnvironmentToken(name);
        } else {
            token = new EnvironmentToken(candidates.get(0));
        }
        context.moveTo(match.get().end());
        context.setCurrentToken(token);

        // an unknown environment is reported once, not again for its commands
        boolean implicit = !token.isRecognized();
        context.setCommand(name, implicit);
        parseToken(context);
        context.setEnvironmentName(name);
        if (parseToken(context) == null) {
            context.takeEnvironmentName();
        }

        LatexContext beforeEnd = context.copy();
        if (context.probe("\\end", true)) {
            parseSpaceToken(context);
            if (context.probe("{" + name + "}", true)) {
                context.setCommand("end" + name, implicit);
                parseToken(context);
                return token;
            }
            beforeEnd.copyInto(context);
        }
        diagnostics.onUnterminatedEnvironment(before, name);
        return token;
    }

    EnvironmentBodyToken parseEnvironmentBodyToken(LatexContext context) {
        context.takeEnvironmentName();
        var token = new EnvironmentBodyToken();
        context.setCurrentToken(token);
        context.setStopLabel(SourceLabel.regex(ENVIRONMENT_END));
        parse(context);
        return token;
    }

    /* Pieces shared by the steps */

    /** Skips one comment line, remembering its text; null if there is none. */
    String parseCommentLine(LatexContext context) {
        Optional<MatchResult> match = context.match(COMMENT);
        if (match.isEmpty()) {
            return null;
        }
        String comment = match.get().group(1);
        context.addComment(comment);
        context.moveTo(match.get().end());
        return comment;
    }

    /**
     * Consumes blanks and comments. The token counts the line breaks outside
     * comments; null if no blank was consumed.
     */
    SpaceToken parseSpaceToken(LatexContext context) {
        boolean consumed = false;
        int lineBreaks = 0;
        while (!context.isAtEnd()) {
            if (parseCommentLine(context) != null) {
                continue;
            }
            char c = context.source().charAt(context.offset());
            if (c == '\n') {
                lineBreaks++;
            } else if (c != ' ' && c != '\t' && c != '\r') {
                break;
            }
            context.advance(1);
            consumed = true;
        }
        return consumed ? new SpaceToken(lineBreaks) : null;
    }

    /** Tries the candidates in order, rolling the context back after each miss. */
    private SymbolToken parsePatterns(LatexContext context, List<? extends SymbolSyntax> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        LatexContext backup = context.copy();
        for (SymbolSyntax candidate : candidates) {
            SymbolToken token = parsePattern(context, candidate);
            if (token != null) {
                return token;
            }
            backup.copyInto(context);
        }
        return null;
    }

    private SymbolToken parsePattern(LatexContext context, SymbolSyntax symbol) {
        SymbolToken token = symbol instanceof CommandSyntax command
            ? new CommandToken(command)
            : new SymbolToken(symbol);
        context.setCurrentToken(token);

        List<PatternComponent> components = symbol.components();
        for (int i = 0; i < components.size(); i++) {
            PatternComponent component = components.get(i);
            if (component instanceof PatternComponent.Literal literal) {
                while (parseCommentLine(context) != null) {
                    // skipped
                }
                if (!context.probe(literal.text(), true)) {
                    return null;
                }
            } else if (component instanceof PatternComponent.Space) {
                parseSpaceToken(context);
            } else if (component instanceof PatternComponent.ParameterSlot slot) {
                context.setParameter(symbol.parameter(slot.index()));
                // a literal right after the parameter closes it
                if (i + 1 < components.size()
                    && components.get(i + 1) instanceof PatternComponent.Literal closing) {
                    context.setStopLabel(SourceLabel.literal(closing.text()));
                    i++;
                }
                if (parseToken(context) == null) {
                    return null;
                }
            }
        }
        if (!context.updateState(symbol.operations())) {
            diagnostics.onUnbalancedGroup(context);
        }
        return token;
    }
}
