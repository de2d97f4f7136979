package org.texparse.tree;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class NodeTest {
    static final class TestNode extends Node<TestNode> {
        private final String name;

        TestNode(String name) {
            this.name = name;
        }

        @Override
        protected TestNode self() {
            return this;
        }

        @Override
        public String typeName() {
            return name;
        }
    }

    private static TestNode node(String name, TestNode... children) {
        var node = new TestNode(name);
        for (TestNode child : children) {
            node.insertSubtree(child);
        }
        return node;
    }

    private static void assertSizesConsistent(TestNode node) {
        int expected = 1;
        for (TestNode child : node.children()) {
            assertSame(node, child.parent());
            assertSizesConsistent(child);
            expected += child.subtreeSize();
        }
        assertEquals(expected, node.subtreeSize(), "size of " + node.typeName());
    }

    @Test void insertChildUpdatesAncestors() {
        var root = new TestNode("root");
        var a = new TestNode("a");
        root.insertChild(a);
        root.insertChild(new TestNode("b"));
        a.insertChild(new TestNode("c"));

        assertEquals(4, root.subtreeSize());
        assertEquals(2, a.subtreeSize());
        assertEquals("root [ a [ c [] ], b [] ]", root.toString());
        assertSizesConsistent(root);
    }

    @Test void insertChildAtIndex() {
        var root = node("root", new TestNode("a"), new TestNode("c"));
        root.insertChild(new TestNode("b"), 1);
        assertEquals("root [ a [], b [], c [] ]", root.toString());
    }

    @Test void insertChildCoversChildren() {
        var b = node("b", new TestNode("d"));
        var root = node("root", new TestNode("a"), b, new TestNode("c"));
        var x = new TestNode("x");

        root.insertChild(x, 1, 2);

        assertEquals("root [ a [], x [ b [ d [] ], c [] ] ]", root.toString());
        assertSame(x, b.parent());
        assertEquals(4, x.subtreeSize());
        assertEquals(6, root.subtreeSize());
        assertSizesConsistent(root);
    }

    @Test void insertSubtreeAddsWholeSize() {
        var a = new TestNode("a");
        var root = node("root", a);
        var sub = node("t", new TestNode("u"), new TestNode("v"));

        a.insertSubtree(sub);

        assertEquals(4, a.subtreeSize());
        assertEquals(5, root.subtreeSize());
        assertSizesConsistent(root);
    }

    @Test void removeChildPromotesChildren() {
        var a = node("a", new TestNode("b"), new TestNode("c"));
        var root = node("root", a, new TestNode("d"));

        assertSame(a, root.removeChild(a));

        assertEquals("root [ b [], c [], d [] ]", root.toString());
        assertNull(a.parent());
        assertEquals(0, a.childCount());
        assertEquals(1, a.subtreeSize());
        assertEquals(4, root.subtreeSize());
        assertSizesConsistent(root);
    }

    @Test void removeSubtreeKeepsChildren() {
        var a = node("a", new TestNode("b"), new TestNode("c"));
        var root = node("root", new TestNode("x"), a);

        assertSame(a, root.removeSubtree(1));

        assertEquals("root [ x [] ]", root.toString());
        assertEquals(3, a.subtreeSize());
        assertEquals(2, root.subtreeSize());
        assertSizesConsistent(a);
    }

    @Test void missesReturnNull() {
        var root = node("root", new TestNode("a"));
        var stranger = new TestNode("s");

        assertNull(root.childAt(1));
        assertNull(root.childAt(-1));
        assertNull(root.childAt(stranger));
        assertNull(root.childIndexOf(stranger));
        assertNull(root.childIndexOf(3));
        assertNull(root.removeChild(stranger));
        assertNull(root.removeChild(5));
        assertNull(root.removeSubtree(stranger));
        assertEquals(0, root.childIndexOf(root.childAt(0)));
    }

    @Test void rejectsNodeWithParent() {
        var a = new TestNode("a");
        var first = node("first", a);
        var second = node("second");

        assertThrows(IllegalArgumentException.class, () -> second.insertChild(a));
        assertEquals(1, second.subtreeSize());
        assertEquals(2, first.subtreeSize());
    }

    @Test void rejectsTreeRoot() {
        var root = new TestNode("root");
        new Tree<>(root);
        var other = new TestNode("other");

        assertThrows(IllegalArgumentException.class, () -> other.insertSubtree(root));
        assertEquals(1, other.subtreeSize());
    }

    @Test void rejectsChildrenOnPlainInsert() {
        var root = node("root", new TestNode("a"));
        var withChild = node("w", new TestNode("x"));

        assertThrows(IllegalArgumentException.class, () -> root.insertChild(withChild, 0, 1));
        assertEquals(2, root.subtreeSize());
        assertEquals("root [ a [] ]", root.toString());
    }

    @Test void rejectsBadPositions() {
        var root = node("root", new TestNode("a"));

        assertThrows(IllegalArgumentException.class, () -> root.insertChild(new TestNode("x"), 2));
        assertThrows(IllegalArgumentException.class, () -> root.insertChild(new TestNode("x"), 0, 2));
        assertThrows(IllegalArgumentException.class, () -> root.insertChild(new TestNode("x"), -1));
        assertEquals(2, root.subtreeSize());
    }

    @Test void rejectsCycles() {
        var a = new TestNode("a");
        var root = node("root", a);

        assertThrows(IllegalArgumentException.class, () -> a.insertSubtree(root));
        assertThrows(IllegalArgumentException.class, () -> root.insertSubtree(root));
    }

    @Test void keyRoots() {
        var b = new TestNode("b");
        var c = new TestNode("c");
        var a = node("a", b, c);
        var root = node("root", a, new TestNode("d"));

        assertTrue(root.isKeyRoot());
        assertFalse(a.isKeyRoot());
        assertFalse(b.isKeyRoot());
        assertTrue(c.isKeyRoot());
        assertTrue(root.childAt(1).isKeyRoot());

        root.removeSubtree(a);
        assertFalse(root.childAt(0).isKeyRoot());
    }

    @Test void sizesStayConsistentThroughEdits() {
        var root = new TestNode("root");
        for (String name : List.of("a", "b", "c", "d")) {
            root.insertChild(new TestNode(name));
        }
        root.insertChild(new TestNode("x"), 1, 2);
        root.childAt(1).insertChild(new TestNode("y"), 0, 1);
        root.insertSubtree(node("t", node("u", new TestNode("v"))), 0);
        assertSizesConsistent(root);

        root.removeChild(root.childAt(2));
        assertSizesConsistent(root);
        root.removeSubtree(0);
        assertSizesConsistent(root);
        assertEquals("root [ a [], y [ b [] ], c [], d [] ]", root.toString());
    }

    @Test void renderingFormats() {
        var root = node("root", node("a", new TestNode("b")), new TestNode("c"));

        assertEquals("root [ a [ ... ], c [] ]", root.toString(Node.Format.TYPES, 2));
        assertEquals("root { a [ b [] ], c [] }", root.toString(Node.Format.ROOT_TYPE, 0));
        assertEquals("a [ b [] ], c []", root.toString(Node.Format.CONTENT, 0));
        assertEquals("leaf {}", new TestNode("leaf").toString(Node.Format.ROOT_TYPE, 0));
        assertEquals("root\n  a\n    b\n  c\n", root.toIndentedString("  ", 0));
        assertEquals("root\n  a\n    ...\n  c\n", root.toIndentedString("  ", 2));
    }
}
