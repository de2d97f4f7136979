package org.texparse.syntax;

import org.texparse.tree.Tree;

/** Token tree over one source text. */
public class SyntaxTree<T extends Token<T>> extends Tree<T> {
    private final String source;

    public SyntaxTree(String source, T root) {
        super(root);
        if (source == null) {
            throw new IllegalArgumentException("source is null");
        }
        this.source = source;
    }

    public String source() {
        return source;
    }
}
