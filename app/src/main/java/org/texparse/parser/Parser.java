package org.texparse.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.texparse.syntax.Token;

/**
 * Tokenizing engine. A subclass decides what to parse next; the engine runs
 * that step, measures what it consumed and hangs the token under the token
 * currently being built.
 */
public abstract class Parser<T extends Token<T>, C extends ParsingContext<T, ?>> {
    private static final Logger log = LogManager.getLogger("parser");

    /** One parsing step. Returns null when nothing could be parsed. */
    @FunctionalInterface
    public interface TokenParser<T, C> {
        T parse(C context);
    }

    public abstract C createContext(String source);

    /** Step to run at the cursor, or null when this nesting level is done. */
    protected abstract TokenParser<T, C> tokenParser(C context);

    /** Consumes source that never forms a token, such as comments. Runs before each stop label check. */
    protected void skipIgnored(C context) {
    }

    public List<T> parse(String source) {
        return parse(createContext(source));
    }

    /**
     * Parses tokens until the context's stop label (consumed on entry) shows
     * up at the cursor, or until the end of input without one.
     */
    public List<T> parse(C context) {
        var tokens = new ArrayList<T>();
        Optional<SourceLabel> stopLabel = context.takeStopLabel();
        T token = null;
        if (stopLabel.isPresent()) {
            while (!atLabel(context, stopLabel.get())) {
                token = parseToken(context);
                if (token == null) {
                    log.debug("stop label " + stopLabel.get() + " not reached, stopped at " + context.offset());
                    break;
                }
                tokens.add(token);
            }
        } else {
            while (!context.isAtEnd()) {
                token = parseToken(context);
                if (token == null) {
                    if (!context.isAtEnd()) {
                        log.debug("stopped early at " + context.offset());
                    }
                    break;
                }
                tokens.add(token);
            }
        }
        return tokens;
    }

    private boolean atLabel(C context, SourceLabel label) {
        skipIgnored(context);
        return context.probe(label, false);
    }

    public T parseToken(C context) {
        TokenParser<T, C> step = tokenParser(context);
        if (step == null) {
            return null;
        }
        T parent = context.currentToken();
        int start = context.offset();
        int shift = start - context.cuttingOffset();
        context.markCut();

        T token = step.parse(context);
        context.setCurrentToken(parent);
        if (token == null) {
            return null;
        }

        context.markCut();
        token.setSourceLength(context.offset() - start);
        token.setSourceShift(shift);
        if (parent != null) {
            parent.insertSubtree(token);
        }
        log.debug("parsed " + token.typeName() + " at " + start + ", length " + token.sourceLength());
        return token;
    }
}
