package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Backs a named workspace with exactly one volume source.
 */
public record WorkspaceBinding(
        String name,
        String subPath,
        String persistentVolumeClaim,
        boolean emptyDir,
        PersistentVolumeClaim volumeClaimTemplate,
        String configMap,
        String secret
) implements Serializable {

    public WorkspaceBinding {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workspace binding name cannot be null or empty");
        }
        int sources = (persistentVolumeClaim != null ? 1 : 0)
                + (emptyDir ? 1 : 0)
                + (volumeClaimTemplate != null ? 1 : 0)
                + (configMap != null ? 1 : 0)
                + (secret != null ? 1 : 0);
        if (sources != 1) {
            throw new IllegalArgumentException(
                    "Workspace binding " + name + " must set exactly one volume source, found " + sources
            );
        }
        if (subPath == null) {
            subPath = "";
        }
    }

    public static WorkspaceBinding claim(String name, String claimName, String subPath) {
        return new WorkspaceBinding(name, subPath, claimName, false, null, null, null);
    }

    public static WorkspaceBinding emptyDir(String name) {
        return new WorkspaceBinding(name, null, null, true, null, null, null);
    }

    public static WorkspaceBinding template(String name, PersistentVolumeClaim template, String subPath) {
        return new WorkspaceBinding(name, subPath, null, false, template, null, null);
    }

    public boolean usesTemplate() {
        return volumeClaimTemplate != null;
    }

    /**
     * Same volume source under a different name and sub-path.
     */
    public WorkspaceBinding rebind(String newName, String newSubPath) {
        return new WorkspaceBinding(newName, newSubPath, persistentVolumeClaim, emptyDir,
                volumeClaimTemplate, configMap, secret);
    }
}
