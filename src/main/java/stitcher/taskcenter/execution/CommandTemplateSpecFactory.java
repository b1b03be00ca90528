package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.Task;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a worker command from a whitespace separated template.
 * Placeholders: {@code {taskId} {type} {name} {outputDir} {threads} {config}}.
 * The task configuration is also passed as {@code TASKCENTER_TASK_CONFIG}.
 */
public final class CommandTemplateSpecFactory implements ProcessSpecFactory {

    private final List<String> template;

    public CommandTemplateSpecFactory(String template) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("worker command template is empty");
        }
        this.template = List.of(template.trim().split("\\s+"));
    }

    @Override
    public ProcessSpec create(Task task, int threadsHint) {
        List<String> command = new ArrayList<>(template.size());
        for (String part : template) {
            command.add(part
                    .replace("{taskId}", Long.toString(task.id()))
                    .replace("{type}", task.type().wireName())
                    .replace("{name}", task.name())
                    .replace("{outputDir}", task.outputDir() != null ? task.outputDir() : "")
                    .replace("{threads}", Integer.toString(threadsHint))
                    .replace("{config}", task.config()));
        }
        Map<String, String> env = Map.of(
                "TASKCENTER_TASK_ID", Long.toString(task.id()),
                "TASKCENTER_TASK_CONFIG", task.config(),
                "TASKCENTER_THREADS", Integer.toString(threadsHint));
        Path workingDir = task.outputDir() != null ? Path.of(task.outputDir()) : null;
        return new ProcessSpec(command, workingDir != null && workingDir.toFile().isDirectory() ? workingDir : null,
                env, List.of());
    }
}
