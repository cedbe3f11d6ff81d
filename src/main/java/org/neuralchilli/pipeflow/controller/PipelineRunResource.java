package org.neuralchilli.pipeflow.controller;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineRunStatus;
import org.neuralchilli.pipeflow.domain.PipelineRunTaskRunStatus;
import org.neuralchilli.pipeflow.domain.StatusCondition;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

@Path("/pipelineruns")
public class PipelineRunResource {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunResource.class);

    private final ControlPlane controlPlane;
    private final ReconcileQueue queue;

    @Inject
    public PipelineRunResource(ControlPlane controlPlane, ReconcileQueue queue) {
        this.controlPlane = controlPlane;
        this.queue = queue;
    }

    @GET
    @Path("/{namespace}/{name}")
    @Produces(MediaType.TEXT_PLAIN)
    public Response describe(@PathParam("namespace") String namespace, @PathParam("name") String name) {
        PipelineRun run = controlPlane.pipelineRuns().get(namespace, name);
        if (run == null) {
            return notFound(namespace, name);
        }
        return Response.ok(describe(run)).build();
    }

    @POST
    @Path("/{namespace}/{name}/cancel")
    @Produces(MediaType.TEXT_PLAIN)
    public Response cancel(@PathParam("namespace") String namespace, @PathParam("name") String name) {
        try {
            PipelineRun run = controlPlane.pipelineRuns().patch(namespace, name,
                    current -> current.withSpec(current.spec().cancelled()));
            log.info("Cancellation requested for pipeline run {}", run.metadata().key());
            queue.enqueue(run.metadata().key());
            return Response.accepted("PipelineRun " + run.metadata().key() + " cancellation requested\n").build();
        } catch (NotFoundException e) {
            return notFound(namespace, name);
        }
    }

    static String describe(PipelineRun run) {
        PipelineRunStatus status = run.status();
        StatusCondition condition = status.condition();

        StringBuilder out = new StringBuilder();
        out.append("PipelineRun ").append(run.metadata().key()).append('\n');
        out.append("Pipeline: ").append(run.pipelineName()).append('\n');
        if (condition == null) {
            out.append("Status: Pending\n");
        } else {
            out.append("Status: ").append(condition.status()).append(" (").append(condition.reason()).append(")\n");
            out.append("Message: ").append(condition.message()).append('\n');
        }
        if (status.startTime() != null) {
            out.append("Started: ").append(status.startTime()).append('\n');
        }
        if (status.completionTime() != null) {
            out.append("Completed: ").append(status.completionTime()).append('\n');
        }

        Map<String, PipelineRunTaskRunStatus> taskRuns = new TreeMap<>(status.taskRuns());
        if (!taskRuns.isEmpty()) {
            out.append("TaskRuns:\n");
            taskRuns.forEach((name, entry) -> {
                String state = entry.status() == null || entry.status().condition() == null
                        ? "Pending" : entry.status().condition().reason();
                out.append("  ").append(name).append(" [").append(entry.pipelineTaskName()).append("] ")
                        .append(state).append('\n');
            });
        }
        status.pipelineResults().forEach(result ->
                out.append("Result ").append(result.name()).append(": ").append(result.value()).append('\n'));
        return out.toString();
    }

    private static Response notFound(String namespace, String name) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity("PipelineRun " + namespace + "/" + name + " not found\n")
                .build();
    }
}
