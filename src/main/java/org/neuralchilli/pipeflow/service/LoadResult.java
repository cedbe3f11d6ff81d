package org.neuralchilli.pipeflow.service;

import org.neuralchilli.pipeflow.store.ObjectKey;

import java.nio.file.Path;
import java.util.Optional;

/**
 * What happened to one definition document, or to a file whose documents could not be read.
 */
public sealed interface LoadResult {

    /**
     * {@code Kind namespace/name} of the object, or the file name when no object was read
     */
    String source();

    default boolean isStored() {
        return this instanceof Stored;
    }

    default Optional<String> error() {
        return Optional.empty();
    }

    /**
     * Written to the control plane, replacing an object with the same key if {@code replaced}.
     */
    record Stored(String kind, ObjectKey key, boolean replaced) implements LoadResult {
        @Override
        public String source() {
            return kind + " " + key;
        }
    }

    /**
     * Parsed but refused by validation or by the store.
     */
    record Rejected(String kind, ObjectKey key, String reason) implements LoadResult {
        @Override
        public String source() {
            return kind + " " + key;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(reason);
        }
    }

    record Unreadable(Path file, String reason) implements LoadResult {
        @Override
        public String source() {
            return file.getFileName().toString();
        }

        @Override
        public Optional<String> error() {
            return Optional.of(reason);
        }
    }
}
