package stitcher.taskcenter.execution;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * How to launch the worker process of one task.
 *
 * @param workingDir      null inherits the application's directory
 * @param expectedOutputs files reported as outputs when they exist after a successful exit
 */
public record ProcessSpec(List<String> command, Path workingDir, Map<String, String> environment,
        List<Path> expectedOutputs) {

    public ProcessSpec {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
        environment = environment != null ? Map.copyOf(environment) : Map.of();
        expectedOutputs = expectedOutputs != null ? List.copyOf(expectedOutputs) : List.of();
    }

    public static ProcessSpec of(List<String> command) {
        return new ProcessSpec(command, null, Map.of(), List.of());
    }
}
