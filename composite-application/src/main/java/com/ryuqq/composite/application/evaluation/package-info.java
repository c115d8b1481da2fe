/**
 * Application Layer - 트리 평가 포트.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composite.application.evaluation.TreeEvaluator} - 평가 인터페이스</li>
 *   <li>{@link com.ryuqq.composite.application.evaluation.Evaluation} - 평가 결과 핸들</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (SequentialTreeEvaluator, ParallelTreeEvaluator)
 *   ↓ implements
 * application (TreeEvaluator interface)
 *   ↓ depends on
 * core (Node, Leaf, Container, TreeAggregator)
 * </pre>
 *
 * @author Composite Team
 * @since 1.0.0
 */
package com.ryuqq.composite.application.evaluation;
