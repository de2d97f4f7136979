package org.texparse.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rooted tree. The root is fixed at construction; everything else is
 * edited through {@link Node}.
 */
public class Tree<T extends Node<T>> {
    private final T root;

    public Tree(T root) {
        if (root == null) {
            throw new IllegalArgumentException("root is null");
        }
        Node<T> node = root;
        node.attachTree(this);
        this.root = root;
    }

    public T root() {
        return root;
    }

    public int size() {
        return root.subtreeSize();
    }

    /**
     * Postorder numbering of the tree, 1-based, with index 0 left empty.
     *
     * @param nodes             nodes by index
     * @param indices           index of each node
     * @param leftmostLeaves    index of the left-most leaf below each index
     * @param keyRoots          key roots in increasing index order
     * @param keyRootIndices    indices of {@code keyRoots}
     */
    public record Enumeration<T>(
        List<T> nodes,
        Map<T, Integer> indices,
        List<Integer> leftmostLeaves,
        List<T> keyRoots,
        List<Integer> keyRootIndices
    ) {
        public T node(int index) {
            return nodes.get(index);
        }

        public int indexOf(T node) {
            Integer index = indices.get(node);
            return index == null ? 0 : index;
        }

        public T leftmostLeaf(int index) {
            return nodes.get(leftmostLeaves.get(index));
        }
    }

    public Enumeration<T> enumerate() {
        var nodes = new ArrayList<T>();
        nodes.add(null);
        collectPostorder(root, nodes);

        var indices = new IdentityHashMap<T, Integer>();
        var leftmost = new ArrayList<Integer>(Collections.nCopies(nodes.size(), 0));
        var keyRoots = new ArrayList<T>();
        var keyRootIndices = new ArrayList<Integer>();

        for (int i = 1; i < nodes.size(); i++) {
            T node = nodes.get(i);
            indices.put(node, i);
            T first = node.childAt(0);
            if (first == null) {
                leftmost.set(i, i);
            } else {
                // the first child's subtree ends right before the node's other children
                int firstIndex = i - node.subtreeSize() + first.subtreeSize();
                leftmost.set(i, leftmost.get(firstIndex));
            }
            if (node.isKeyRoot()) {
                keyRoots.add(node);
                keyRootIndices.add(i);
            }
        }

        return new Enumeration<>(
            Collections.unmodifiableList(nodes),
            Collections.unmodifiableMap(indices),
            Collections.unmodifiableList(leftmost),
            Collections.unmodifiableList(keyRoots),
            Collections.unmodifiableList(keyRootIndices)
        );
    }

    private void collectPostorder(T node, List<T> out) {
        for (T child : node.children()) {
            collectPostorder(child, out);
        }
        out.add(node);
    }
}
