package org.texparse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.texparse.parser.Position;

/** Offset to line/column lookup over a precomputed line index. */
public class SpanUtils {
    // Offsets at which each line starts; line 1 starts at 0.
    public static List<Integer> lineIndex(String source) {
        var index = new ArrayList<Integer>();
        index.add(0);
        for (int i = source.indexOf('\n'); i >= 0; i = source.indexOf('\n', i + 1)) {
            index.add(i + 1);
        }
        return index;
    }

    // Same numbering as ParsingContext.position(): 1-based line and column.
    public static Position locate(int offset, List<Integer> lineIndex) {
        int found = Collections.binarySearch(lineIndex, offset);
        // binarySearch returns (-(insertion_point) - 1) on a miss
        int lineIdx = found >= 0 ? found : -(found + 1) - 1;
        return new Position(lineIdx + 1, offset - lineIndex.get(lineIdx) + 1);
    }

    public static String formatSpan(int offset, int length, List<Integer> lineIndex) {
        var first = locate(offset, lineIndex);
        var last = locate(Math.max(offset, offset + length - 1), lineIndex);
        return first + ".." + last;
    }
}
