/**
 * Aggregation of a tree into a single rendered value.
 *
 * <ul>
 *   <li>{@link com.ryuqq.composite.core.aggregation.TreeAggregator} - Iterative, order-preserving fold</li>
 *   <li>{@link com.ryuqq.composite.core.aggregation.Aggregate} - Rendering plus subtree statistics</li>
 * </ul>
 *
 * <p>Grammar: {@code Leaf | Branch(<node>{+<node>})}.</p>
 *
 * <p>The fold reads the tree through the public {@code core.node} API only
 * ({@code Container.size()}, {@code Container.childAt(int)}, {@code Leaf.execute()}).
 * {@code Container.execute()} calls back into {@link com.ryuqq.composite.core.aggregation.TreeAggregator#render};
 * that is the only edge in the other direction.</p>
 *
 * @since 1.0.0
 * @author Composite Team
 */
package com.ryuqq.composite.core.aggregation;
