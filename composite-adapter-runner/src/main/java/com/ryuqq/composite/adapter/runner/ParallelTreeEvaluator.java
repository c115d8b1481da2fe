package com.ryuqq.composite.adapter.runner;

import com.ryuqq.composite.application.evaluation.Evaluation;
import com.ryuqq.composite.application.evaluation.EvaluationException;
import com.ryuqq.composite.application.evaluation.TreeEvaluator;
import com.ryuqq.composite.core.aggregation.Aggregate;
import com.ryuqq.composite.core.aggregation.TreeAggregator;
import com.ryuqq.composite.core.node.Container;
import com.ryuqq.composite.core.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 루트 자식 하위 트리를 병렬로 평가하는 구현체.
 *
 * <p>형제 하위 트리 사이에는 읽기/쓰기 충돌이 없으므로 독립 작업으로 평가한 뒤
 * <strong>삽입 순서대로</strong> 재결합합니다. 순서는 외부에서 관찰 가능한 결과입니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>루트가 Leaf이거나 자식 수가 minChildrenForFanOut 미만 → 호출 스레드에서 순차 평가</li>
 *   <li>그 외: 자식 목록 스냅샷을 만들고 자식마다 {@link TreeAggregator#aggregate} 작업 제출</li>
 *   <li>Future를 제출 순서대로 대기하여 결과 수집</li>
 *   <li>{@link TreeAggregator#combine}으로 루트 집계 결과 생성</li>
 * </ol>
 *
 * <p><strong>제약:</strong> 평가 중 트리 구조를 변경하면 안 됩니다 (내부 잠금 없음).</p>
 *
 * <p><strong>수명:</strong> 설정으로 생성한 경우 스레드 풀을 소유하며 {@link #close()}에서 종료합니다.
 * 외부 ExecutorService를 주입한 경우 종료 책임은 호출자에게 있습니다.
 * {@link #close()} 이후의 fan-out 평가는 작업 제출이 거부되어 {@link EvaluationException}으로 실패합니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class ParallelTreeEvaluator implements TreeEvaluator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelTreeEvaluator.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ExecutorService executorService;
    private final ParallelEvaluatorConfig config;
    private final boolean ownsExecutor;

    /**
     * 생성자 (기본 설정, 자체 스레드 풀).
     */
    public ParallelTreeEvaluator() {
        this(new ParallelEvaluatorConfig());
    }

    /**
     * 생성자 (자체 스레드 풀).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ParallelTreeEvaluator(ParallelEvaluatorConfig config) {
        this(newPool(config), config, true);
    }

    /**
     * 생성자 (외부 ExecutorService 주입).
     *
     * @param executorService 하위 트리 평가에 사용할 ExecutorService
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ParallelTreeEvaluator(ExecutorService executorService, ParallelEvaluatorConfig config) {
        this(executorService, config, false);
    }

    private ParallelTreeEvaluator(ExecutorService executorService, ParallelEvaluatorConfig config,
                                  boolean ownsExecutor) {
        if (executorService == null) {
            throw new IllegalArgumentException("executorService cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.executorService = executorService;
        this.config = config;
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public Evaluation evaluate(Node root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }

        long startNanos = System.nanoTime();
        Aggregate aggregate;
        if (root instanceof Container container && container.size() >= config.minChildrenForFanOut()) {
            aggregate = fanOut(container);
        } else {
            aggregate = TreeAggregator.aggregate(root);
        }
        long elapsedNanos = System.nanoTime() - startNanos;

        log.debug("Evaluated {} in parallel: {} nodes, height {} in {}ns",
            root, aggregate.nodeCount(), aggregate.height(), elapsedNanos);
        return Evaluation.of(root, aggregate, elapsedNanos);
    }

    /**
     * 자식 하위 트리를 병렬 평가 후 삽입 순서대로 재결합.
     *
     * @param container 루트 Container
     * @return 루트 집계 결과
     * @throws EvaluationException 작업 제출 거부, 하위 트리 평가 실패 또는 인터럽트 시
     */
    private Aggregate fanOut(Container container) {
        List<Node> children = container.getChildren();
        List<Future<Aggregate>> futures = new ArrayList<>(children.size());
        List<Aggregate> results = new ArrayList<>(children.size());
        try {
            for (Node child : children) {
                futures.add(executorService.submit(() -> TreeAggregator.aggregate(child)));
            }
            for (Future<Aggregate> future : futures) {
                results.add(future.get());
            }
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            log.warn("Subtree evaluation rejected under {} after {} submissions", container, futures.size());
            throw new EvaluationException("Parallel evaluation rejected for " + container, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new EvaluationException("Parallel evaluation interrupted for " + container, e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            log.warn("Subtree evaluation failed under {}", container, e.getCause());
            throw new EvaluationException("Parallel evaluation failed for " + container, e.getCause());
        }

        return TreeAggregator.combine(results);
    }

    private static void cancelAll(List<Future<Aggregate>> futures) {
        for (Future<Aggregate> future : futures) {
            future.cancel(true);
        }
    }

    public ParallelEvaluatorConfig getConfig() {
        return config;
    }

    /**
     * 소유한 스레드 풀 종료.
     *
     * <p>외부에서 주입된 ExecutorService는 종료하지 않습니다.</p>
     */
    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Evaluator pool did not terminate within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        log.info("ParallelTreeEvaluator closed");
    }

    private static ExecutorService newPool(ParallelEvaluatorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        log.info("Starting evaluator pool with parallelism {}", config.parallelism());
        return Executors.newFixedThreadPool(config.parallelism(), new EvaluatorThreadFactory());
    }

    private static final class EvaluatorThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "composite-evaluator-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
