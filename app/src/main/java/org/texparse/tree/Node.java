package org.texparse.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Element of an ordered n-ary ownership tree.
 *
 * <p>Each node has at most one parent and caches the size of its subtree
 * (itself plus all descendants). Every structural operation validates its
 * preconditions before touching anything and then fixes the cached sizes of
 * the node and all of its ancestors.
 *
 * @param <T> the concrete node type
 */
public abstract class Node<T extends Node<T>> {
    /*
     * Structure
     */
    private T parent;
    private final ArrayList<T> children = new ArrayList<>();
    private int subtreeSize = 1;

    // Only set on a tree root.
    private Tree<T> tree;

    public enum Format {
        /** {@code Type [ child, child ]} for every node. */
        TYPES,
        /** {@code Type { content }} for the node itself, content below it. */
        ROOT_TYPE,
        /** Content only. */
        CONTENT
    }

    /** This node as its own type. */
    protected abstract T self();

    /** Parent node, or null for a root. */
    public T parent() {
        return parent;
    }

    public List<T> children() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public int subtreeSize() {
        return subtreeSize;
    }

    /** Tree this node belongs to, or null while detached. */
    public Tree<T> tree() {
        Node<T> node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node.tree;
    }

    void attachTree(Tree<T> owner) {
        if (parent != null) {
            throw new IllegalArgumentException("tree root must not have a parent");
        }
        if (tree != null) {
            throw new IllegalArgumentException("node is already a tree root");
        }
        tree = owner;
    }

    /**
     * A key root is either the root or a node that is not the left-most
     * child of its parent.
     */
    public boolean isKeyRoot() {
        if (parent == null) {
            return true;
        }
        Node<T> owner = parent;
        return owner.children.get(0) != this;
    }

    /* Lookup */

    public T childAt(int index) {
        return index >= 0 && index < children.size() ? children.get(index) : null;
    }

    public T childAt(T node) {
        return node != null && node.parent() == this ? node : null;
    }

    public Integer childIndexOf(T node) {
        if (node == null || node.parent() != this) {
            return null;
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == node) {
                return i;
            }
        }
        return null;
    }

    public Integer childIndexOf(int index) {
        return index >= 0 && index < children.size() ? index : null;
    }

    /* Insertion */

    public void insertChild(T node) {
        insertChild(node, children.size(), 0);
    }

    public void insertChild(T node, int index) {
        insertChild(node, index, 0);
    }

    /**
     * Inserts a childless node at {@code index}; the {@code coveredCount}
     * children starting there move under the new node.
     */
    public void insertChild(T node, int index, int coveredCount) {
        checkDetached(node);
        if (node.childCount() > 0) {
            throw new IllegalArgumentException("inserted node already has children");
        }
        checkPosition(index, coveredCount);
        beforeChildInserted(node, index, coveredCount);

        List<T> range = children.subList(index, index + coveredCount);
        var covered = new ArrayList<T>(range);
        range.clear();
        children.add(index, node);
        Node<T> inserted = node;
        inserted.parent = self();

        int size = 1;
        for (Node<T> child : covered) {
            child.parent = node;
            size += child.subtreeSize;
        }
        inserted.children.addAll(covered);
        inserted.subtreeSize = size;
        updateAncestors(1);
    }

    public void insertSubtree(T node) {
        insertSubtree(node, children.size());
    }

    public void insertSubtree(T node, int index) {
        checkDetached(node);
        checkPosition(index, 0);
        beforeChildInserted(node, index, 0);
        children.add(index, node);
        Node<T> inserted = node;
        inserted.parent = self();
        updateAncestors(inserted.subtreeSize);
    }

    /* Removal */

    /** Removes one node, promoting its children into its place. */
    public T removeChild(T node) {
        Integer index = childIndexOf(node);
        return index == null ? null : removeAt(index, true);
    }

    public T removeChild(int index) {
        return childIndexOf(index) == null ? null : removeAt(index, true);
    }

    /** Removes a node together with everything below it. */
    public T removeSubtree(T node) {
        Integer index = childIndexOf(node);
        return index == null ? null : removeAt(index, false);
    }

    public T removeSubtree(int index) {
        return childIndexOf(index) == null ? null : removeAt(index, false);
    }

    private T removeAt(int index, boolean promote) {
        T node = children.get(index);
        beforeChildRemoved(node, index, promote);
        children.remove(index);
        Node<T> removed = node;
        removed.parent = null;
        if (!promote) {
            updateAncestors(-removed.subtreeSize);
            return node;
        }
        for (Node<T> child : removed.children) {
            child.parent = self();
        }
        children.addAll(index, removed.children);
        removed.children.clear();
        removed.subtreeSize = 1;
        updateAncestors(-1);
        return node;
    }

    /* Hooks */

    /** Whether this node may be placed under {@code parent}. */
    protected boolean canBeChildOf(T parent) {
        return true;
    }

    /** Called after validation, before {@code node} is spliced in. */
    protected void beforeChildInserted(T node, int index, int coveredCount) {
    }

    /** Called before {@code node} is taken out of the child list. */
    protected void beforeChildRemoved(T node, int index, boolean promoteChildren) {
    }

    /* Helpers */

    private void checkDetached(T node) {
        if (node == null) {
            throw new IllegalArgumentException("node is null");
        }
        Node<T> candidate = node;
        if (candidate.parent != null) {
            throw new IllegalArgumentException("node already has a parent");
        }
        if (candidate.tree != null) {
            throw new IllegalArgumentException("node already belongs to a tree");
        }
        for (Node<T> ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == candidate) {
                throw new IllegalArgumentException("node is an ancestor of the target");
            }
        }
        if (!candidate.canBeChildOf(self())) {
            throw new IllegalArgumentException(
                node.typeName() + " cannot be a child of " + typeName());
        }
    }

    private void checkPosition(int index, int coveredCount) {
        if (index < 0 || index > children.size()) {
            throw new IllegalArgumentException("child index out of range: " + index);
        }
        if (coveredCount < 0 || index + coveredCount > children.size()) {
            throw new IllegalArgumentException("covered count out of range: " + coveredCount);
        }
    }

    private void updateAncestors(int delta) {
        for (Node<T> node = this; node != null; node = node.parent) {
            node.subtreeSize += delta;
        }
    }

    /* Rendering */

    public String typeName() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return toString(Format.TYPES, 0);
    }

    /** Renders the subtree on one line; a positive {@code maxDepth} cuts it. */
    public String toString(Format format, int maxDepth) {
        var sb = new StringBuilder();
        switch (format) {
            case TYPES -> appendTypes(sb, maxDepth, 0);
            case ROOT_TYPE -> appendRootType(sb, maxDepth);
            case CONTENT -> appendContent(sb, maxDepth, 0);
        }
        return sb.toString();
    }

    public String toIndentedString(String indent, int maxDepth) {
        var sb = new StringBuilder();
        appendIndented(sb, indent, maxDepth, 0);
        return sb.toString();
    }

    private void appendTypes(StringBuilder sb, int maxDepth, int depth) {
        sb.append(typeName());
        if (children.isEmpty()) {
            sb.append(" []");
        } else if (maxDepth > 0 && depth + 1 >= maxDepth) {
            sb.append(" [ ... ]");
        } else {
            sb.append(" [ ");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                Node<T> child = children.get(i);
                child.appendTypes(sb, maxDepth, depth + 1);
            }
            sb.append(" ]");
        }
    }

    protected void appendRootType(StringBuilder sb, int maxDepth) {
        sb.append(typeName());
        if (children.isEmpty()) {
            sb.append(" {}");
        } else {
            sb.append(" { ");
            appendContent(sb, maxDepth, 0);
            sb.append(" }");
        }
    }

    /** Content of the node below its own type; children joined by default. */
    protected void appendContent(StringBuilder sb, int maxDepth, int depth) {
        if (maxDepth > 0 && depth + 1 >= maxDepth && !children.isEmpty()) {
            sb.append("...");
            return;
        }
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Node<T> child = children.get(i);
            child.appendTypes(sb, maxDepth, depth + 1);
        }
    }

    private void appendIndented(StringBuilder sb, String indent, int maxDepth, int depth) {
        sb.append(indent.repeat(depth)).append(typeName()).append('\n');
        if (maxDepth > 0 && depth + 1 >= maxDepth) {
            if (!children.isEmpty()) {
                sb.append(indent.repeat(depth + 1)).append("...\n");
            }
            return;
        }
        for (Node<T> child : children) {
            child.appendIndented(sb, indent, maxDepth, depth + 1);
        }
    }
}
