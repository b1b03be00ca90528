package stitcher.taskcenter.execution;

import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.model.TaskType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandTemplateSpecFactoryTest {

    @Test
    void substitutesPlaceholders(@TempDir Path dir) {
        Task task = Task.builder().id(42).type(TaskType.LOSSLESS_GRID).name("grid").status(TaskStatus.RUNNING)
                .outputDir(dir.toString()).config("{\"cols\":3}").build();

        ProcessSpec spec = new CommandTemplateSpecFactory("  worker --task {taskId} --type {type}  --threads {threads} --out {outputDir} ")
                .create(task, 4);

        assertEquals(List.of("worker", "--task", "42", "--type", "lossless_grid", "--threads", "4",
                "--out", dir.toString()), spec.command());
        assertEquals(dir, spec.workingDir());
        assertEquals("{\"cols\":3}", spec.environment().get("TASKCENTER_TASK_CONFIG"));
        assertEquals("42", spec.environment().get("TASKCENTER_TASK_ID"));
        assertEquals("4", spec.environment().get("TASKCENTER_THREADS"));
    }

    @Test
    void missingOutputDirIsNotUsedAsWorkingDir() {
        Task task = Task.builder().id(1).type(TaskType.VIDEO_MERGE).status(TaskStatus.RUNNING)
                .outputDir("/definitely/not/here").build();
        ProcessSpec spec = new CommandTemplateSpecFactory("worker {name}").create(task, 1);
        assertNull(spec.workingDir());
        assertEquals(List.of("worker", ""), spec.command());
    }

    @Test
    void rejectsBlankTemplate() {
        assertThrows(IllegalArgumentException.class, () -> new CommandTemplateSpecFactory(" "));
    }
}
