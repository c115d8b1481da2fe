package com.ryuqq.composite.testkit.contract;

import com.ryuqq.composite.core.node.Container;
import com.ryuqq.composite.core.node.Leaf;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for parent consistency.
 *
 * <p>A node's parent reference is set exactly when it is added to a container
 * and cleared exactly when it is removed.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>add sets the parent (leaf and container children)</li>
 *   <li>remove clears the parent</li>
 *   <li>new nodes have no parent</li>
 *   <li>parent chain navigation (root, depth) follows the references</li>
 * </ul>
 *
 * @author Composite Team
 * @since 1.0.0
 */
class ParentConsistencyContractTest extends AbstractTreeContractTest {

    @Test
    void testParent_NewNodes_HaveNoParent() {
        // Given
        Leaf leaf = leaf();
        Container container = branch();

        // Then
        assertNoParent(leaf);
        assertNoParent(container);
    }

    @Test
    void testParent_AddThenRemoveLeaf_SetsAndClearsParent() {
        // Given
        Container parent = branch();
        Leaf child = leaf();

        // When: add
        parent.add(child);

        // Then
        assertParent(child, parent);

        // When: remove
        boolean removed = parent.remove(child);

        // Then
        assertTrue(removed);
        assertNoParent(child);
        assertTrue(parent.isEmpty());
    }

    @Test
    void testParent_AddThenRemoveContainer_SetsAndClearsParent() {
        // Given
        Container parent = branch();
        Container child = branch(leaf());

        // When
        parent.add(child);

        // Then
        assertParent(child, parent);
        assertInvariants(parent);

        // When
        parent.remove(child);

        // Then
        assertNoParent(child);
        assertInvariants(parent);
        assertInvariants(child);
    }

    @Test
    void testParent_RemovedSubtree_KeepsInternalParents() {
        // Given
        Leaf leaf = leaf();
        Container inner = branch(leaf);
        Container root = branch(inner);

        // When
        root.remove(inner);

        // Then: detached subtree stays internally consistent
        assertParent(leaf, inner);
        assertNoParent(inner);
        assertSame(inner, leaf.root());
        assertEquals(1, leaf.depth());
    }

    @Test
    void testParent_Navigation_FollowsReferences() {
        // Given
        Leaf leaf = leaf();
        Container b = branch(leaf);
        Container a = branch(b);
        Container root = branch(a);

        // Then
        assertSame(root, leaf.root());
        assertEquals(3, leaf.depth());
        assertTrue(leaf.isDescendantOf(a));
        assertTrue(root.isAncestorOf(leaf));
        assertFalse(b.isAncestorOf(a));
    }
}
