package org.neuralchilli.pipeflow.domain;

/**
 * A volume claim, either provisioned for a run or used as a template in a workspace binding.
 */
public record PersistentVolumeClaim(ObjectMeta metadata, PersistentVolumeClaimSpec spec)
        implements ClusterObject<PersistentVolumeClaim> {

    public PersistentVolumeClaim {
        if (metadata == null) {
            throw new IllegalArgumentException("Volume claim metadata cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("Volume claim spec cannot be null");
        }
    }

    @Override
    public PersistentVolumeClaim withMetadata(ObjectMeta newMetadata) {
        return new PersistentVolumeClaim(newMetadata, spec);
    }
}
