/**
 * Runner Adapter Layer - TreeEvaluator 구현체와 클라이언트 드라이버.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.composite.adapter.runner.SequentialTreeEvaluator} - 호출 스레드 순차 평가</li>
 *   <li>{@link com.ryuqq.composite.adapter.runner.ParallelTreeEvaluator} - 루트 자식 병렬 평가, 순서 보존 재결합</li>
 *   <li>{@link com.ryuqq.composite.adapter.runner.CompositeClient} - 트리 구성 및 결과 출력</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (SequentialTreeEvaluator, ParallelTreeEvaluator)
 *   ↓ implements
 * application (TreeEvaluator interface)
 *   ↓ depends on
 * core (Node, Container, TreeAggregator)
 * </pre>
 *
 * @author Composite Team
 * @since 1.0.0
 */
package com.ryuqq.composite.adapter.runner;
