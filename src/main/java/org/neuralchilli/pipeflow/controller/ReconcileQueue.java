package org.neuralchilli.pipeflow.controller;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.vertx.ConsumeEvent;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.pipeflow.config.PipeflowConfig;
import org.neuralchilli.pipeflow.reconciler.PipelineRunReconciler;
import org.neuralchilli.pipeflow.reconciler.ReconcileException;
import org.neuralchilli.pipeflow.store.ControlPlane;
import org.neuralchilli.pipeflow.store.ObjectKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Work queue of pipeline run keys on the Vert.x event bus.
 *
 * A key is queued at most once and never processed by two workers at the same time; a key
 * enqueued while it is being processed is queued again when the pass ends. Failed passes
 * are retried with exponential backoff.
 */
@ApplicationScoped
public class ReconcileQueue {

    private static final Logger log = LoggerFactory.getLogger(ReconcileQueue.class);

    public static final String ADDRESS = "pipelinerun.reconcile";

    private final PipelineRunReconciler reconciler;
    private final ControlPlane controlPlane;
    private final EventBus eventBus;
    private final Vertx vertx;
    private final PipeflowConfig.Queue settings;

    private final Set<String> queued = new HashSet<>();
    private final Set<String> active = new HashSet<>();
    private final Set<String> dirty = new HashSet<>();
    private final Map<String, Integer> failures = new ConcurrentHashMap<>();

    @Inject
    public ReconcileQueue(PipelineRunReconciler reconciler, ControlPlane controlPlane, EventBus eventBus,
                          Vertx vertx, PipeflowConfig config) {
        this.reconciler = reconciler;
        this.controlPlane = controlPlane;
        this.eventBus = eventBus;
        this.vertx = vertx;
        this.settings = config.queue();
    }

    void onStart(@Observes StartupEvent event) {
        long interval = settings.resyncInterval().toMillis();
        if (interval <= 0) {
            log.info("Periodic resync disabled");
            return;
        }
        vertx.setPeriodic(interval, id -> resync());
        log.info("Resyncing pipeline runs every {}", settings.resyncInterval());
    }

    /**
     * Ask for a pass over the run stored under {@code key}.
     */
    public void enqueue(String key) {
        synchronized (this) {
            if (active.contains(key)) {
                dirty.add(key);
                return;
            }
            if (!queued.add(key)) {
                return;
            }
        }
        eventBus.send(ADDRESS, key);
    }

    /**
     * Enqueue every stored run.
     */
    public void resync() {
        Set<ObjectKey> keys = controlPlane.pipelineRuns().keys();
        log.debug("Resyncing {} pipeline runs", keys.size());
        keys.forEach(key -> enqueue(key.toString()));
    }

    @ConsumeEvent(value = ADDRESS, blocking = true)
    public void process(String key) {
        synchronized (this) {
            queued.remove(key);
            if (!active.add(key)) {
                dirty.add(key);
                return;
            }
        }

        try {
            reconciler.reconcile(key);
            failures.remove(key);
        } catch (ReconcileException e) {
            log.warn("Reconcile of {} failed, will retry: {}", key, e.getMessage());
            retryLater(key);
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling {}", key, e);
            retryLater(key);
        } finally {
            boolean again;
            synchronized (this) {
                active.remove(key);
                again = dirty.remove(key);
            }
            if (again) {
                enqueue(key);
            }
        }
    }

    private void retryLater(String key) {
        int attempt = failures.merge(key, 1, Integer::sum);
        Duration delay = backoff(attempt, settings.baseBackoff(), settings.maxBackoff());
        log.debug("Retrying {} in {} (attempt {})", key, delay, attempt);
        vertx.setTimer(Math.max(1, delay.toMillis()), id -> enqueue(key));
    }

    /**
     * {@code base * 2^(attempt-1)}, capped at {@code max}.
     */
    static Duration backoff(int attempt, Duration base, Duration max) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        Duration delay = base.multipliedBy(1L << shift);
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
