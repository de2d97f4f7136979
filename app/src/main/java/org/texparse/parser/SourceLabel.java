package org.texparse.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Delimiter of a nested sub-parse: literal text or a regular expression.
 */
public sealed interface SourceLabel permits SourceLabel.Literal, SourceLabel.Regex {

    static SourceLabel literal(String text) {
        return new Literal(text);
    }

    static SourceLabel regex(Pattern pattern) {
        return new Regex(pattern);
    }

    /** Length of the match starting exactly at {@code offset}, or -1. */
    int matchLength(String source, int offset);

    /** Offset of the first match at or after {@code from}, or -1. */
    int indexIn(String source, int from);

    record Literal(String text) implements SourceLabel {
        public Literal {
            if (text == null || text.isEmpty()) {
                throw new IllegalArgumentException("label must be non-empty text");
            }
        }

        @Override
        public int matchLength(String source, int offset) {
            return source.startsWith(text, offset) ? text.length() : -1;
        }

        @Override
        public int indexIn(String source, int from) {
            return source.indexOf(text, from);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    record Regex(Pattern pattern) implements SourceLabel {
        public Regex {
            if (pattern == null) {
                throw new IllegalArgumentException("label pattern is null");
            }
        }

        @Override
        public int matchLength(String source, int offset) {
            Matcher matcher = pattern.matcher(source);
            matcher.region(offset, source.length());
            return matcher.lookingAt() ? matcher.end() - offset : -1;
        }

        @Override
        public int indexIn(String source, int from) {
            Matcher matcher = pattern.matcher(source);
            return matcher.find(from) ? matcher.start() : -1;
        }

        @Override
        public String toString() {
            return "/" + pattern.pattern() + "/";
        }
    }
}
