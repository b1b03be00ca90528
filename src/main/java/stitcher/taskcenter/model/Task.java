package stitcher.taskcenter.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model of a submitted media job.
 * Updated copies are produced with {@link #toBuilder()}.
 */
public final class Task {
    private final long id;
    private final TaskType type;
    private final String name;
    private final TaskStatus status;
    private final int priority;
    private final int progress;
    private final String currentStep;
    private final int retryCount;
    private final int maxRetry;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final long executionTime; // busy millis, paused time excluded
    private final Long pid;
    private final Instant pidStartedAt;
    private final String outputDir;
    private final String config; // JSON object text
    private final List<TaskFile> files;
    private final List<TaskOutput> outputs;
    private final TaskError error;

    private Task(Builder builder) {
        this.id = builder.id;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.name = builder.name != null ? builder.name : "";
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = builder.priority;
        this.progress = Math.max(0, Math.min(100, builder.progress));
        this.currentStep = builder.currentStep;
        this.retryCount = builder.retryCount;
        this.maxRetry = builder.maxRetry;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.executionTime = builder.executionTime;
        this.pid = builder.pid;
        this.pidStartedAt = builder.pidStartedAt;
        this.outputDir = builder.outputDir;
        this.config = builder.config != null ? builder.config : "{}";
        this.files = builder.files != null ? List.copyOf(builder.files) : List.of();
        this.outputs = builder.outputs != null ? List.copyOf(builder.outputs) : List.of();
        this.error = builder.error;
    }

    public long id() {
        return id;
    }

    public TaskType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public TaskStatus status() {
        return status;
    }

    public int priority() {
        return priority;
    }

    public int progress() {
        return progress;
    }

    public String currentStep() {
        return currentStep;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetry() {
        return maxRetry;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public long executionTime() {
        return executionTime;
    }

    public Long pid() {
        return pid;
    }

    public Instant pidStartedAt() {
        return pidStartedAt;
    }

    public String outputDir() {
        return outputDir;
    }

    public String config() {
        return config;
    }

    public List<TaskFile> files() {
        return files;
    }

    public List<TaskOutput> outputs() {
        return outputs;
    }

    public TaskError error() {
        return error;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Check if the retry budget is not exhausted */
    public boolean canRetry() {
        return retryCount < maxRetry;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .name(name)
                .status(status)
                .priority(priority)
                .progress(progress)
                .currentStep(currentStep)
                .retryCount(retryCount)
                .maxRetry(maxRetry)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .executionTime(executionTime)
                .pid(pid)
                .pidStartedAt(pidStartedAt)
                .outputDir(outputDir)
                .config(config)
                .files(files)
                .outputs(outputs)
                .error(error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private TaskType type;
        private String name;
        private TaskStatus status = TaskStatus.PENDING;
        private int priority = 0;
        private int progress = 0;
        private String currentStep;
        private int retryCount = 0;
        private int maxRetry = 3;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;
        private long executionTime;
        private Long pid;
        private Instant pidStartedAt;
        private String outputDir;
        private String config;
        private List<TaskFile> files;
        private List<TaskOutput> outputs;
        private TaskError error;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder currentStep(String currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetry(int maxRetry) {
            this.maxRetry = maxRetry;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder executionTime(long executionTime) {
            this.executionTime = executionTime;
            return this;
        }

        public Builder pid(Long pid) {
            this.pid = pid;
            return this;
        }

        public Builder pidStartedAt(Instant pidStartedAt) {
            this.pidStartedAt = pidStartedAt;
            return this;
        }

        public Builder outputDir(String outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder config(String config) {
            this.config = config;
            return this;
        }

        public Builder files(List<TaskFile> files) {
            this.files = files;
            return this;
        }

        public Builder outputs(List<TaskOutput> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder error(TaskError error) {
            this.error = error;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return id == task.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", type=" + type.wireName() + ", status=" + status.wireName()
                + ", progress=" + progress + "}";
    }
}
