/**
 * Tree node package: the closed set of node variants and their structural operations.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composite.core.node.Node} - Sealed interface (permits Leaf, Container)</li>
 * </ul>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composite.core.node.Leaf} - Terminal node rendering its payload</li>
 *   <li>{@link com.ryuqq.composite.core.node.Container} - Owns ordered children, aggregates their results</li>
 * </ul>
 *
 * <h2>Support</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composite.core.node.Trees} - Uniform construction, mutation and query API</li>
 *   <li>{@link com.ryuqq.composite.core.node.TreeInvariants} - Structural invariant checker</li>
 *   <li>{@link com.ryuqq.composite.core.node.TreeStructureException} - Base of structural errors
 *       ({@link com.ryuqq.composite.core.node.CycleDetectedException},
 *       {@link com.ryuqq.composite.core.node.InvalidOperationException})</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Type Safety:</strong> add/remove exist only on Container</li>
 *   <li><strong>Single Ownership:</strong> adding a node re-parents it, never shares it</li>
 *   <li><strong>Navigational Parent:</strong> the parent reference is used for upward lookups only</li>
 * </ul>
 *
 * <h2>Dependencies</h2>
 * <p>{@link com.ryuqq.composite.core.node.Container#execute()} is the only reference from this
 * package into {@code core.aggregation}: it delegates to
 * {@link com.ryuqq.composite.core.aggregation.TreeAggregator#render}. No other type here
 * imports the aggregation package.</p>
 *
 * @since 1.0.0
 * @author Composite Team
 */
package com.ryuqq.composite.core.node;
