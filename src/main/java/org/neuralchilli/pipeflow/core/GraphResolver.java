package org.neuralchilli.pipeflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.pipeflow.domain.PipelineSpec;
import org.neuralchilli.pipeflow.domain.PipelineTask;
import org.neuralchilli.pipeflow.domain.PipelineTaskCondition;
import org.neuralchilli.pipeflow.domain.PipelineTaskInputResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the dependency graph of a pipeline with JGraphT.
 * Edges come from {@code runAfter}, from input resources' {@code from} links and from
 * result references in the task's params and condition params.
 */
@ApplicationScoped
public class GraphResolver {

    private static final Logger log = LoggerFactory.getLogger(GraphResolver.class);

    private final ExpressionEvaluator expressions;

    @Inject
    public GraphResolver(ExpressionEvaluator expressions) {
        this.expressions = expressions;
    }

    /**
     * @throws InvalidGraphException if a dependency names an unknown task or a name is repeated
     * @throws GraphCycleException   if the dependencies form a cycle
     */
    public PipelineDag build(PipelineSpec spec) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);

        // First pass: one vertex per pipeline task
        for (PipelineTask task : spec.tasks()) {
            if (!dag.addVertex(task.name())) {
                throw new InvalidGraphException("Pipeline task name " + task.name() + " is used more than once");
            }
        }

        // Second pass: dependency edges, from dependency to dependent
        for (PipelineTask task : spec.tasks()) {
            for (String dependency : dependenciesOf(task)) {
                if (!dag.containsVertex(dependency)) {
                    throw new InvalidGraphException(
                            "Pipeline task " + task.name() + " depends on " + dependency
                                    + " which does not exist in the pipeline"
                    );
                }
                try {
                    dag.addEdge(dependency, task.name());
                    log.trace("Added edge: {} -> {}", dependency, task.name());
                } catch (IllegalArgumentException e) {
                    // JGraphT rejects edges that would close a cycle, self loops included
                    throw new GraphCycleException(
                            "Adding dependency " + dependency + " -> " + task.name()
                                    + " would create a cycle in the pipeline", e
                    );
                }
            }
        }

        Map<String, Set<String>> predecessors = new LinkedHashMap<>();
        for (String node : dag.vertexSet()) {
            Set<String> in = new LinkedHashSet<>();
            dag.incomingEdgesOf(node).forEach(e -> in.add(dag.getEdgeSource(e)));
            predecessors.put(node, in);
        }

        List<String> order = new ArrayList<>();
        new TopologicalOrderIterator<>(dag).forEachRemaining(order::add);

        log.debug("Pipeline graph built: {} tasks, {} edges", dag.vertexSet().size(), dag.edgeSet().size());
        return new PipelineDag(predecessors, order);
    }

    /**
     * Names of the tasks {@code task} must wait for, in declaration order.
     */
    public Set<String> dependenciesOf(PipelineTask task) {
        Set<String> dependencies = new LinkedHashSet<>(task.runAfter());
        for (PipelineTaskInputResource input : task.resources().inputs()) {
            dependencies.addAll(input.from());
        }
        expressions.resultReferences(task.params()).forEach(r -> dependencies.add(r.pipelineTask()));
        for (PipelineTaskCondition condition : task.conditions()) {
            expressions.resultReferences(condition.params()).forEach(r -> dependencies.add(r.pipelineTask()));
            condition.resources().forEach(input -> dependencies.addAll(input.from()));
        }
        return dependencies;
    }
}
