package com.ryuqq.composite.adapter.runner;

import com.ryuqq.composite.application.evaluation.TreeEvaluator;
import com.ryuqq.composite.testkit.contract.TreeEvaluatorContractTest;

/**
 * Contract Tests for {@link SequentialTreeEvaluator}.
 *
 * @author Composite Team
 * @since 1.0.0
 */
class SequentialTreeEvaluatorContractTest extends TreeEvaluatorContractTest {

    @Override
    protected TreeEvaluator createEvaluator() {
        return new SequentialTreeEvaluator();
    }
}
