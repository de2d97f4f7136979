package org.texparse.syntax;

import java.util.List;

import org.texparse.tree.Node;
import org.texparse.tree.Tree;

/**
 * Syntax tree node that knows which part of the source it covers.
 *
 * <p>Only the length and the shift (gap after the previous sibling, or after
 * the parent's start for a first child) are stored. Absolute offsets are
 * derived from the ancestors and preceding siblings.
 */
public abstract class Token<T extends Token<T>> extends Node<T> {
    private Integer sourceLength;
    private int sourceShift;

    public Integer sourceLength() {
        return sourceLength;
    }

    public void setSourceLength(Integer length) {
        if (length != null && length < 0) {
            throw new IllegalArgumentException("negative source length: " + length);
        }
        sourceLength = length;
    }

    public int sourceShift() {
        return sourceShift;
    }

    public void setSourceShift(int shift) {
        if (shift < 0) {
            throw new IllegalArgumentException("negative source shift: " + shift);
        }
        sourceShift = shift;
    }

    /** Absolute offset, or null if some length on the way is unresolved. */
    public Integer sourceOffset() {
        T parent = parent();
        if (parent == null) {
            return sourceShift;
        }
        Integer offset = parent.sourceOffset();
        if (offset == null) {
            return null;
        }
        for (T sibling : parent.children()) {
            if (sibling == this) {
                break;
            }
            if (sibling.sourceLength() == null) {
                return null;
            }
            offset += sibling.sourceShift() + sibling.sourceLength();
        }
        return offset + sourceShift;
    }

    /** Source text covered by the token, or null outside a resolved syntax tree. */
    public String sourceText() {
        Tree<T> tree = tree();
        if (!(tree instanceof SyntaxTree<T> syntaxTree) || sourceLength == null) {
            return null;
        }
        Integer offset = sourceOffset();
        if (offset == null) {
            return null;
        }
        return syntaxTree.source().substring(offset, offset + sourceLength);
    }

    /* Shift bookkeeping under edits */

    @Override
    protected void beforeChildInserted(T node, int index, int coveredCount) {
        if (coveredCount == 0 || node.sourceLength() != null) {
            return;
        }
        Integer extent = extentOf(children().subList(index, index + coveredCount));
        if (extent == null) {
            return;
        }
        T first = childAt(index);
        node.setSourceShift(first.sourceShift());
        node.setSourceLength(extent - first.sourceShift());
        first.setSourceShift(0);
    }

    @Override
    protected void beforeChildRemoved(T node, int index, boolean promoteChildren) {
        if (node.sourceLength() == null) {
            return;
        }
        T next = childAt(index + 1);
        if (!promoteChildren || node.childCount() == 0) {
            if (next != null) {
                next.setSourceShift(next.sourceShift() + node.sourceShift() + node.sourceLength());
            }
            return;
        }
        Integer inner = extentOf(node.children());
        if (inner == null) {
            return;
        }
        T first = node.childAt(0);
        first.setSourceShift(first.sourceShift() + node.sourceShift());
        if (next != null) {
            next.setSourceShift(next.sourceShift() + node.sourceLength() - inner);
        }
    }

    private static <T extends Token<T>> Integer extentOf(List<T> tokens) {
        int extent = 0;
        for (T token : tokens) {
            if (token.sourceLength() == null) {
                return null;
            }
            extent += token.sourceShift() + token.sourceLength();
        }
        return extent;
    }

    /* Rendering */

    @Override
    protected void appendRootType(StringBuilder sb, int maxDepth) {
        sb.append(typeName()).append(" { \"");
        appendContent(sb, maxDepth, 0);
        sb.append("\" }");
    }
}
