package com.ryuqq.composite.adapter.runner;

/**
 * ParallelTreeEvaluator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>parallelism: 작업자 스레드 수 (기본: 가용 프로세서 수)</li>
 *   <li>minChildrenForFanOut: 루트 자식이 이 수 이상일 때만 병렬 분기 (기본 2)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>루트 자식 하위 트리가 크고 균등할수록 병렬 이득이 큼</li>
 *   <li>작은 트리는 스레드 전환 비용이 더 크므로 minChildrenForFanOut을 높임</li>
 * </ul>
 *
 * @author Composite Team
 * @since 1.0.0
 * @param parallelism 작업자 스레드 수 (1 이상)
 * @param minChildrenForFanOut 병렬 분기 최소 자식 수 (1 이상)
 */
public record ParallelEvaluatorConfig(int parallelism, int minChildrenForFanOut) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: parallelism=가용 프로세서 수, minChildrenForFanOut=2</p>
     */
    public ParallelEvaluatorConfig() {
        this(Runtime.getRuntime().availableProcessors(), 2);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ParallelEvaluatorConfig {
        if (parallelism <= 0) {
            throw new IllegalArgumentException(
                "parallelism must be positive (current: " + parallelism + ")"
            );
        }
        if (minChildrenForFanOut <= 0) {
            throw new IllegalArgumentException(
                "minChildrenForFanOut must be positive (current: " + minChildrenForFanOut + ")"
            );
        }
    }

    /**
     * parallelism만 변경한 새 인스턴스 생성.
     *
     * @param parallelism 새로운 작업자 스레드 수
     * @return 새 ParallelEvaluatorConfig 인스턴스
     */
    public ParallelEvaluatorConfig withParallelism(int parallelism) {
        return new ParallelEvaluatorConfig(parallelism, this.minChildrenForFanOut);
    }

    /**
     * minChildrenForFanOut만 변경한 새 인스턴스 생성.
     *
     * @param minChildrenForFanOut 새로운 병렬 분기 최소 자식 수
     * @return 새 ParallelEvaluatorConfig 인스턴스
     */
    public ParallelEvaluatorConfig withMinChildrenForFanOut(int minChildrenForFanOut) {
        return new ParallelEvaluatorConfig(this.parallelism, minChildrenForFanOut);
    }
}
