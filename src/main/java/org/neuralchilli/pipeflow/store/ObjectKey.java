package org.neuralchilli.pipeflow.store;

import javax.annotation.Nonnull;
import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * Map key of a stored object: namespace plus name.
 * Cluster-scoped objects use the empty namespace.
 * Written by {@link org.neuralchilli.pipeflow.serializer.ObjectKeySerializer}.
 */
public final class ObjectKey implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String namespace;
    private final String name;

    public ObjectKey(String namespace, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Object name cannot be null or empty");
        }
        this.namespace = namespace == null ? "" : namespace;
        this.name = name;
    }

    public static ObjectKey of(String namespace, String name) {
        return new ObjectKey(namespace, name);
    }

    /**
     * Parse a {@code namespace/name} key. Returns null for anything with more or fewer segments.
     */
    public static ObjectKey parse(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        String[] parts = key.split("/", -1);
        if (parts.length == 1) {
            return parts[0].isBlank() ? null : new ObjectKey("", parts[0]);
        }
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return null;
        }
        return new ObjectKey(parts[0], parts[1]);
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ObjectKey that = (ObjectKey) obj;
        return Objects.equals(namespace, that.namespace) &&
                Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Nonnull
    @Override
    public String toString() {
        return namespace.isEmpty() ? name : namespace + "/" + name;
    }
}
