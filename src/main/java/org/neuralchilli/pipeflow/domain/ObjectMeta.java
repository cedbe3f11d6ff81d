package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity, labels and bookkeeping shared by every control-plane object.
 * {@code resourceVersion} is 0 until the store has accepted the object.
 */
public record ObjectMeta(
        String name,
        String namespace,
        String uid,
        Map<String, String> labels,
        Map<String, String> annotations,
        List<OwnerReference> ownerReferences,
        long resourceVersion,
        Instant creationTimestamp
) implements Serializable {

    public ObjectMeta {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Object name cannot be null or empty");
        }
        if (resourceVersion < 0) {
            throw new IllegalArgumentException("Resource version cannot be negative");
        }

        // Defaults
        if (namespace == null) {
            namespace = "";
        }
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        ownerReferences = ownerReferences == null ? List.of() : List.copyOf(ownerReferences);
    }

    /**
     * Metadata for a new, not yet stored object.
     */
    public static ObjectMeta of(String namespace, String name) {
        return new ObjectMeta(name, namespace, null, Map.of(), Map.of(), List.of(), 0, null);
    }

    /**
     * Metadata for a cluster-scoped object.
     */
    public static ObjectMeta clusterScoped(String name) {
        return of("", name);
    }

    public ObjectMeta withLabels(Map<String, String> newLabels) {
        return new ObjectMeta(name, namespace, uid, newLabels, annotations, ownerReferences,
                resourceVersion, creationTimestamp);
    }

    /**
     * Copy with one label added or replaced.
     */
    public ObjectMeta withLabel(String key, String value) {
        Map<String, String> merged = new HashMap<>(labels);
        merged.put(key, value);
        return withLabels(merged);
    }

    public ObjectMeta withAnnotations(Map<String, String> newAnnotations) {
        return new ObjectMeta(name, namespace, uid, labels, newAnnotations, ownerReferences,
                resourceVersion, creationTimestamp);
    }

    public ObjectMeta withOwnerReferences(List<OwnerReference> references) {
        return new ObjectMeta(name, namespace, uid, labels, annotations, references,
                resourceVersion, creationTimestamp);
    }

    public ObjectMeta withResourceVersion(long version) {
        return new ObjectMeta(name, namespace, uid, labels, annotations, ownerReferences,
                version, creationTimestamp);
    }

    /**
     * Stamp assigned by the store when the object is first created.
     */
    public ObjectMeta created(String newUid, Instant at) {
        return new ObjectMeta(name, namespace, newUid, labels, annotations, ownerReferences, 1, at);
    }

    public String label(String key) {
        return labels.get(key);
    }

    /**
     * True if the controlling owner reference points at the given owner uid.
     */
    public boolean isControlledBy(String ownerUid) {
        return ownerReferences.stream()
                .anyMatch(ref -> ref.controller() && ref.uid() != null && ref.uid().equals(ownerUid));
    }

    /**
     * Namespaced key in the {@code namespace/name} form used by the work queue.
     */
    public String key() {
        return namespace.isEmpty() ? name : namespace + "/" + name;
    }
}
