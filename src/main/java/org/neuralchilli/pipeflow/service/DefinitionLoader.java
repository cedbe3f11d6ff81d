package org.neuralchilli.pipeflow.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.config.PipeflowConfig;
import org.neuralchilli.pipeflow.config.YamlParser;
import org.neuralchilli.pipeflow.core.DefinitionException;
import org.neuralchilli.pipeflow.domain.ClusterObject;
import org.neuralchilli.pipeflow.domain.ClusterTask;
import org.neuralchilli.pipeflow.domain.Condition;
import org.neuralchilli.pipeflow.domain.ObjectMeta;
import org.neuralchilli.pipeflow.domain.Pipeline;
import org.neuralchilli.pipeflow.domain.PipelineResource;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.Task;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.ObjectKey;
import org.neuralchilli.pipeflow.store.ObjectStore;
import org.neuralchilli.pipeflow.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads pipelines, tasks, conditions, resources and runs from YAML files into the control plane.
 * Existing objects with the same key are replaced; a stored run keeps its status.
 */
@ApplicationScoped
public class DefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);

    private final YamlParser yamlParser;
    private final PipelineRunValidator validator;
    private final ControlPlane controlPlane;
    private final PipeflowConfig.Definitions settings;

    @Inject
    public DefinitionLoader(YamlParser yamlParser, PipelineRunValidator validator, ControlPlane controlPlane,
                            PipeflowConfig config) {
        this.yamlParser = yamlParser;
        this.validator = validator;
        this.controlPlane = controlPlane;
        this.settings = config.definitions();
    }

    void onStart(@Observes StartupEvent event) {
        if (!settings.loadOnStart()) {
            return;
        }
        if (settings.path().isEmpty()) {
            log.warn("pipeflow.definitions.load-on-start is set but pipeflow.definitions.path is not");
            return;
        }
        log.info("Loading definitions from: {}", settings.path().get());
        logResults(loadAll(Path.of(settings.path().get())));
    }

    /**
     * Load every {@code .yaml} and {@code .yml} file below a directory.
     */
    public List<LoadResult> loadAll(Path directory) {
        List<LoadResult> results = new ArrayList<>();

        if (!Files.exists(directory)) {
            log.warn("Definitions directory does not exist: {}", directory);
            return results;
        }

        try (Stream<Path> paths = Files.walk(directory)) {
            paths.filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                    .sorted()
                    .forEach(path -> results.addAll(loadFile(path)));
        } catch (IOException e) {
            log.error("Error scanning definitions directory: {}", directory, e);
        }

        return results;
    }

    /**
     * Load every document of one file. A file that cannot be read or parsed yields one failure.
     */
    public List<LoadResult> loadFile(Path path) {
        List<ClusterObject<?>> objects;
        try {
            log.debug("Loading definitions from: {}", path);
            objects = yamlParser.parse(Files.readString(path));
        } catch (IOException e) {
            log.error("Failed to read definitions file: {}", path, e);
            return List.of(new LoadResult.Unreadable(path, messageOf(e)));
        } catch (RuntimeException e) {
            log.error("Failed to parse definitions file: {}", path, e);
            return List.of(new LoadResult.Unreadable(path, messageOf(e)));
        }

        List<LoadResult> results = new ArrayList<>();
        for (ClusterObject<?> object : objects) {
            results.add(load(object));
        }
        return results;
    }

    /**
     * Validate and store one parsed object.
     */
    public LoadResult load(ClusterObject<?> object) {
        String kind = object.getClass().getSimpleName();
        ObjectKey key = ObjectKey.of(object.namespace(), object.name());
        boolean replaced;
        try {
            if (object instanceof Pipeline pipeline) {
                validator.validatePipeline(pipeline.name(), pipeline.spec());
                replaced = createOrReplace(controlPlane.pipelines(), pipeline);
            } else if (object instanceof Task task) {
                replaced = createOrReplace(controlPlane.tasks(), task);
            } else if (object instanceof ClusterTask clusterTask) {
                replaced = createOrReplace(controlPlane.clusterTasks(), clusterTask);
            } else if (object instanceof Condition condition) {
                replaced = createOrReplace(controlPlane.conditions(), condition);
            } else if (object instanceof PipelineResource resource) {
                replaced = createOrReplace(controlPlane.resources(), resource);
            } else if (object instanceof PipelineRun run) {
                PipelineRun stored = controlPlane.pipelineRuns().get(run.namespace(), run.name());
                replaced = createOrReplace(controlPlane.pipelineRuns(), stored == null ? run : run.withStatus(stored.status()));
            } else {
                return new LoadResult.Rejected(kind, key, "Unsupported object type: " + kind);
            }
        } catch (DefinitionException | StoreException e) {
            log.error("Failed to load {} {}: {}", kind, key, e.getMessage());
            return new LoadResult.Rejected(kind, key, messageOf(e));
        }
        log.info("{} {} {}", replaced ? "Replaced" : "Loaded", kind, key);
        return new LoadResult.Stored(kind, key, replaced);
    }

    /**
     * Returns true if an object with the same key was replaced.
     */
    private <T extends ClusterObject<T>> boolean createOrReplace(ObjectStore<T> store, T object) {
        T existing = store.get(object.namespace(), object.name());
        if (existing == null) {
            store.create(object);
            return false;
        }
        ObjectMeta stored = existing.metadata();
        ObjectMeta meta = object.metadata();
        store.update(object.withMetadata(new ObjectMeta(meta.name(), meta.namespace(), stored.uid(), meta.labels(),
                meta.annotations(), stored.ownerReferences(), stored.resourceVersion(), stored.creationTimestamp())));
        return true;
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void logResults(List<LoadResult> results) {
        long stored = results.stream().filter(LoadResult::isStored).count();
        long replaced = results.stream()
                .filter(r -> r instanceof LoadResult.Stored s && s.replaced())
                .count();

        log.info("Loaded {} definitions ({} stored, {} of them replaced, {} failed)",
                results.size(), stored, replaced, results.size() - stored);

        results.forEach(r -> r.error().ifPresent(error -> log.warn("  Failed: {} - {}", r.source(), error)));
    }
}
