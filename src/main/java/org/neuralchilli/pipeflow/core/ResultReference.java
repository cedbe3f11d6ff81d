package org.neuralchilli.pipeflow.core;

/**
 * A {@code $(tasks.<pipelineTask>.results.<result>)} reference.
 */
public record ResultReference(String pipelineTask, String result) {

    public ResultReference {
        if (pipelineTask == null || pipelineTask.isBlank()) {
            throw new IllegalArgumentException("Result reference must name a pipeline task");
        }
        if (result == null || result.isBlank()) {
            throw new IllegalArgumentException("Result reference must name a result");
        }
    }

    public static ResultReference of(String pipelineTask, String result) {
        return new ResultReference(pipelineTask, result);
    }

    /**
     * Reference text without the {@code $( )} wrapper.
     */
    public String expression() {
        return ExpressionContext.TASKS + pipelineTask + ".results." + result;
    }

    @Override
    public String toString() {
        return "$(" + expression() + ")";
    }
}
