package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

/**
 * One container step of a task. Executed by the task engine, never by this service.
 */
public record Step(
        String name,
        String image,
        List<String> command,
        List<String> args,
        String script
) implements Serializable {

    public Step {
        command = command == null ? List.of() : List.copyOf(command);
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static Step of(String name, String image, List<String> command, List<String> args) {
        return new Step(name, image, command, args, null);
    }

    public Step withName(String newName) {
        return new Step(newName, image, command, args, script);
    }

    public Step withImage(String newImage) {
        return new Step(name, newImage, command, args, script);
    }

    public Step withCommandAndArgs(List<String> newCommand, List<String> newArgs) {
        return new Step(name, image, newCommand, newArgs, script);
    }

    public Step withScript(String newScript) {
        return new Step(name, image, command, args, newScript);
    }
}
