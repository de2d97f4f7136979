package org.texparse.parser;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.texparse.syntax.Token;

/**
 * Forward-only cursor over a source text.
 *
 * <p>Backtracking never moves the offset back: take a {@link #copy()} before
 * an attempt and {@link #copyInto(ParsingContext) copy it back} on failure.
 *
 * @param <T> token type under construction
 * @param <S> parser state type
 */
public class ParsingContext<T extends Token<T>, S extends ParserState<S>> {
    /*
     * Source
     */
    private final String source;
    private int offset;
    private int cuttingOffset;

    /*
     * State
     */
    private S state;
    private ArrayDeque<S> stateStack = new ArrayDeque<>();
    private SourceLabel stopLabel;
    private T currentToken;

    public ParsingContext(String source, S initialState) {
        if (source == null) {
            throw new IllegalArgumentException("source is null");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("initial state is null");
        }
        this.source = source;
        this.state = initialState;
    }

    protected ParsingContext(ParsingContext<T, S> other) {
        this.source = other.source;
        this.state = other.state;
        other.copyFields(this);
    }

    public ParsingContext<T, S> copy() {
        return new ParsingContext<>(this);
    }

    /** Overwrites {@code target} with an independent copy of this context. */
    public void copyInto(ParsingContext<T, S> target) {
        if (!target.source.equals(source)) {
            throw new IllegalArgumentException("contexts parse different sources");
        }
        copyFields(target);
    }

    private void copyFields(ParsingContext<T, S> target) {
        target.offset = offset;
        target.cuttingOffset = cuttingOffset;
        target.state = state.copy();
        var stack = new ArrayDeque<S>();
        for (S saved : stateStack) {
            stack.addLast(saved.copy());
        }
        target.stateStack = stack;
        target.stopLabel = stopLabel;
        target.currentToken = currentToken;
    }

    /* Source cursor */

    public String source() {
        return source;
    }

    public int offset() {
        return offset;
    }

    public int cuttingOffset() {
        return cuttingOffset;
    }

    public boolean isAtEnd() {
        return offset >= source.length();
    }

    /** Character at the cursor as a string (a full code point), or null at the end. */
    public String currentChar() {
        if (isAtEnd()) {
            return null;
        }
        int codePoint = source.codePointAt(offset);
        return source.substring(offset, offset + Character.charCount(codePoint));
    }

    public void advance(int count) {
        moveTo(offset + count);
    }

    public void moveTo(int newOffset) {
        if (newOffset < offset) {
            throw new IllegalArgumentException(
                "offset may only move forward: " + offset + " -> " + newOffset);
        }
        if (newOffset > source.length()) {
            throw new IllegalArgumentException("offset beyond source end: " + newOffset);
        }
        offset = newOffset;
    }

    public void markCut() {
        cuttingOffset = offset;
    }

    public boolean probe(String text) {
        return probe(SourceLabel.literal(text), false);
    }

    public boolean probe(String text, boolean consume) {
        return probe(SourceLabel.literal(text), consume);
    }

    public boolean probe(Pattern pattern, boolean consume) {
        return probe(SourceLabel.regex(pattern), consume);
    }

    public boolean probe(SourceLabel label, boolean consume) {
        int length = label.matchLength(source, offset);
        if (length < 0) {
            return false;
        }
        if (consume) {
            advance(length);
        }
        return true;
    }

    /** Match anchored at the cursor; the offset is left alone. */
    public Optional<MatchResult> match(Pattern pattern) {
        Matcher matcher = pattern.matcher(source);
        matcher.region(offset, source.length());
        return matcher.lookingAt() ? Optional.of(matcher.toMatchResult()) : Optional.empty();
    }

    /** Line and column of the cursor, found by scanning back. */
    public Position position() {
        if (offset <= 0) {
            return new Position(1, 1);
        }
        int lineBreak = source.lastIndexOf('\n', offset - 1);
        if (lineBreak < 0) {
            return new Position(1, offset + 1);
        }
        int line = 2;
        for (int i = source.lastIndexOf('\n', lineBreak - 1); i >= 0; i = source.lastIndexOf('\n', i - 1)) {
            line++;
        }
        return new Position(line, offset - lineBreak);
    }

    /* State */

    public S state() {
        return state;
    }

    public void pushState() {
        stateStack.push(state.copy());
    }

    /** Restores the last pushed state; false if nothing was pushed. */
    public boolean popState() {
        S saved = stateStack.poll();
        if (saved == null) {
            return false;
        }
        state = saved;
        return true;
    }

    public int stateDepth() {
        return stateStack.size();
    }

    /* Stop label */

    public Optional<SourceLabel> stopLabel() {
        return Optional.ofNullable(stopLabel);
    }

    public void setStopLabel(SourceLabel label) {
        if (label == null) {
            throw new IllegalArgumentException("stop label is null");
        }
        if (stopLabel != null) {
            throw new IllegalStateException("stop label is already set: " + stopLabel);
        }
        stopLabel = label;
    }

    public Optional<SourceLabel> takeStopLabel() {
        var label = Optional.ofNullable(stopLabel);
        stopLabel = null;
        return label;
    }

    /* Token under construction */

    public T currentToken() {
        return currentToken;
    }

    public void setCurrentToken(T token) {
        currentToken = token;
    }
}
