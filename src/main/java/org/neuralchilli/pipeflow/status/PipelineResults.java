package org.neuralchilli.pipeflow.status;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.core.ExpressionContext;
import org.neuralchilli.pipeflow.core.ExpressionEvaluator;
import org.neuralchilli.pipeflow.domain.PipelineResult;
import org.neuralchilli.pipeflow.domain.PipelineRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a pipeline's declared results against the results of its tasks.
 */
@ApplicationScoped
public class PipelineResults {

    private static final Logger log = LoggerFactory.getLogger(PipelineResults.class);

    private final ExpressionEvaluator expressions;

    @Inject
    public PipelineResults(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    /**
     * Results whose task references all resolve; the others are left out.
     */
    public List<PipelineRunResult> evaluate(List<PipelineResult> declared, ExpressionContext context) {
        List<PipelineRunResult> results = new ArrayList<>();
        for (PipelineResult result : declared) {
            boolean resolvable = expressions.resultReferences(result.value()).stream()
                    .allMatch(ref -> context.contains(ref.expression()));
            if (!resolvable) {
                log.debug("Pipeline result {} refers to results that were not produced, omitting it", result.name());
                continue;
            }
            results.add(new PipelineRunResult(result.name(), expressions.evaluate(result.value(), context)));
        }
        return results;
    }
}
