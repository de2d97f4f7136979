package org.texparse.latex.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Piece of a symbol pattern. */
public sealed interface PatternComponent
    permits PatternComponent.Literal, PatternComponent.ParameterSlot, PatternComponent.Space {

    /** Source text matched verbatim. */
    record Literal(String text) implements PatternComponent {
        @Override
        public String toString() {
            return text;
        }
    }

    /** Zero-based reference into the symbol's parameter list. */
    record ParameterSlot(int index) implements PatternComponent {
        @Override
        public String toString() {
            return "#" + (index + 1);
        }
    }

    /** Run of blanks; comments in it are skipped. */
    record Space() implements PatternComponent {
        @Override
        public String toString() {
            return " ";
        }
    }

    Pattern PIECE = Pattern.compile("[ \\t]+|#\\d+|[^ \\t#]+");

    static List<PatternComponent> parse(String pattern, int parameterCount) {
        var components = new ArrayList<PatternComponent>();
        Matcher matcher = PIECE.matcher(pattern);
        int end = 0;
        while (matcher.find()) {
            if (matcher.start() != end) {
                throw new IllegalArgumentException("malformed pattern: " + pattern);
            }
            end = matcher.end();
            String piece = matcher.group();
            char first = piece.charAt(0);
            if (first == ' ' || first == '\t') {
                components.add(new Space());
            } else if (first == '#') {
                int index = Integer.parseInt(piece.substring(1)) - 1;
                if (index < 0 || index >= parameterCount) {
                    throw new IllegalArgumentException(
                        "pattern " + pattern + " refers to missing parameter " + piece);
                }
                components.add(new ParameterSlot(index));
            } else {
                components.add(new Literal(piece));
            }
        }
        if (end != pattern.length()) {
            throw new IllegalArgumentException("malformed pattern: " + pattern);
        }
        return List.copyOf(components);
    }
}
