package org.neuralchilli.pipeflow.store;

import org.neuralchilli.pipeflow.domain.ClusterObject;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Typed access to one kind of control-plane object with optimistic concurrency.
 *
 * @param <T> stored object type
 */
public interface ObjectStore<T extends ClusterObject<T>> {

    /**
     * Kind name used in messages and logs.
     */
    String kind();

    /**
     * Fetch an object, or null if absent.
     */
    T get(String namespace, String name);

    /**
     * List objects in a namespace whose labels contain every entry of {@code selector}.
     * Results are ordered by name.
     */
    List<T> list(String namespace, Map<String, String> selector);

    /**
     * Keys of every stored object, across namespaces.
     */
    Set<ObjectKey> keys();

    /**
     * Store a new object. Assigns uid, creation time and version 1.
     *
     * @throws AlreadyExistsException if the key is taken
     */
    T create(T object);

    /**
     * Replace a stored object. The object's resource version must equal the stored one;
     * the returned copy carries the incremented version.
     *
     * @throws ConflictException if the stored version differs
     * @throws NotFoundException if nothing is stored under the key
     */
    T update(T object);

    /**
     * Read-modify-write without a caller-supplied version, retried on conflict.
     *
     * @throws NotFoundException if nothing is stored under the key
     * @throws ConflictException if every attempt conflicted
     */
    T patch(String namespace, String name, UnaryOperator<T> mutation);

    /**
     * Register a listener for added and updated objects. Returns a registration id.
     */
    String watch(Consumer<T> listener);

    /**
     * Remove a listener registered with {@link #watch}.
     */
    void unwatch(String registrationId);

    default List<T> list(String namespace) {
        return list(namespace, Map.of());
    }
}
