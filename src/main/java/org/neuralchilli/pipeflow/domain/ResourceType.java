package org.neuralchilli.pipeflow.domain;

/**
 * Kind of data a pipeline resource represents.
 */
public enum ResourceType {
    GIT("git"),
    IMAGE("image"),
    STORAGE("storage"),
    CLUSTER("cluster"),
    PULL_REQUEST("pullRequest"),
    CLOUD_EVENT("cloudEvent");

    private final String value;

    ResourceType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ResourceType fromValue(String value) {
        for (ResourceType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + value);
    }
}
