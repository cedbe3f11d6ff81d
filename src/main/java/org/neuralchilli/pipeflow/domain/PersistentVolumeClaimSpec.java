package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

public record PersistentVolumeClaimSpec(
        List<String> accessModes,
        String storage,
        String storageClassName
) implements Serializable {

    public static final String READ_WRITE_ONCE = "ReadWriteOnce";

    public PersistentVolumeClaimSpec {
        accessModes = accessModes == null || accessModes.isEmpty() ? List.of(READ_WRITE_ONCE) : List.copyOf(accessModes);
        if (storage == null || storage.isBlank()) {
            throw new IllegalArgumentException("Volume claim must request a storage size");
        }
    }
}
