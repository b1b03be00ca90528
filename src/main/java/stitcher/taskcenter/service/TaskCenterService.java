package stitcher.taskcenter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.event.EventSink;
import stitcher.taskcenter.event.TaskEvent;
import stitcher.taskcenter.model.NewTask;
import stitcher.taskcenter.model.QueueStatus;
import stitcher.taskcenter.model.SettingKey;
import stitcher.taskcenter.model.Task;
import stitcher.taskcenter.model.TaskCenterSettings;
import stitcher.taskcenter.model.TaskFile;
import stitcher.taskcenter.model.TaskLog;
import stitcher.taskcenter.model.TaskNotFoundException;
import stitcher.taskcenter.model.TaskPage;
import stitcher.taskcenter.model.TaskQuery;
import stitcher.taskcenter.model.TaskStatus;
import stitcher.taskcenter.model.TaskType;
import stitcher.taskcenter.model.ValidationException;
import stitcher.taskcenter.repository.SettingsRepository;
import stitcher.taskcenter.repository.TaskLogRepository;
import stitcher.taskcenter.repository.TaskRepository;
import stitcher.taskcenter.scheduler.TaskScheduler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control surface of the task center.
 * Validates input, then delegates to the stores and the scheduler.
 */
public class TaskCenterService {

    private static final Logger log = LoggerFactory.getLogger(TaskCenterService.class);

    private final TaskRepository tasks;
    private final TaskLogRepository logs;
    private final SettingsRepository settings;
    private final TaskScheduler scheduler;
    private final EventSink events;
    private final ObjectMapper mapper;

    public TaskCenterService(TaskRepository tasks,
            TaskLogRepository logs,
            SettingsRepository settings,
            TaskScheduler scheduler,
            EventSink events,
            ObjectMapper mapper) {
        this.tasks = tasks;
        this.logs = logs;
        this.settings = settings;
        this.scheduler = scheduler;
        this.events = events;
        this.mapper = mapper;
    }

    // ==================== Submission ====================

    /**
     * Validate and persist a new task. It is queued right away when
     * {@code autoStartTasks} is on, otherwise it stays pending.
     *
     * @throws ValidationException if the submission is malformed
     */
    public Task submit(TaskSubmission submission) {
        NewTask newTask = validate(submission);
        Task task = tasks.create(newTask);
        log.info("Task {} submitted: {} '{}' with {} files", task.id(), task.type().wireName(), task.name(),
                task.files().size());
        events.notify(TaskEvent.of(TaskEvent.Type.CREATED, task.id(), TaskStatus.PENDING));

        if (settings.load().autoStartTasks()) {
            scheduler.enqueue(task.id());
            return tasks.findById(task.id()).orElse(task);
        }
        return task;
    }

    /**
     * Submit several tasks; invalid items are reported by index and do not stop the others.
     */
    public BatchSubmitResult batchSubmit(List<TaskSubmission> submissions) {
        if (submissions == null || submissions.isEmpty()) {
            throw new ValidationException("batch must contain at least one task");
        }
        List<Task> created = new ArrayList<>();
        List<BatchSubmitResult.ItemError> errors = new ArrayList<>();
        for (int i = 0; i < submissions.size(); i++) {
            try {
                created.add(submit(submissions.get(i)));
            } catch (ValidationException e) {
                errors.add(new BatchSubmitResult.ItemError(i, e.getMessage()));
            }
        }
        log.info("Batch submit: {} created, {} rejected", created.size(), errors.size());
        return new BatchSubmitResult(created, errors);
    }

    NewTask validate(TaskSubmission submission) {
        if (submission == null) {
            throw new ValidationException("submission is required");
        }
        if (submission.type() == null || submission.type().isBlank()) {
            throw new ValidationException("type is required");
        }
        TaskType type = TaskType.fromWire(submission.type());

        if (submission.outputDir() == null || submission.outputDir().isBlank()) {
            throw new ValidationException("outputDir is required");
        }

        List<TaskFile> files = submission.files() != null ? submission.files() : List.of();
        if (type.requiresInputs() && files.isEmpty()) {
            throw new ValidationException(type.wireName() + " requires at least one input file");
        }
        for (int i = 0; i < files.size(); i++) {
            TaskFile file = files.get(i);
            if (file == null || file.path() == null || file.path().isBlank()) {
                throw new ValidationException("files[" + i + "].path is required");
            }
        }

        if (submission.maxRetry() != null && submission.maxRetry() < 0) {
            throw new ValidationException("maxRetry must be >= 0");
        }

        String config = normalizeConfig(submission.config());
        String name = submission.name() != null && !submission.name().isBlank()
                ? submission.name().trim()
                : type.displayName();
        int priority = submission.priority() != null ? submission.priority() : 0;

        return new NewTask(type, name, submission.outputDir().trim(), config, files, priority,
                submission.maxRetry());
    }

    private String normalizeConfig(String config) {
        if (config == null || config.isBlank()) {
            return "{}";
        }
        try {
            JsonNode node = mapper.readTree(config);
            if (node == null || !node.isObject()) {
                throw new ValidationException("config must be a JSON object");
            }
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ValidationException("config is not valid JSON: " + e.getOriginalMessage());
        }
    }

    // ==================== Queries ====================

    /**
     * @throws TaskNotFoundException if the task does not exist
     */
    public Task get(long taskId) {
        return tasks.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public TaskPage list(TaskQuery query) {
        return tasks.list(query);
    }

    public QueueStatus queueStatus() {
        return scheduler.queueStatus();
    }

    public CpuInfo cpuInfo() {
        return CpuInfo.current();
    }

    // ==================== Control ====================

    public boolean start(long taskId) {
        return scheduler.enqueue(taskId);
    }

    public boolean cancel(long taskId) {
        return scheduler.cancel(taskId);
    }

    public boolean retry(long taskId) {
        return scheduler.retry(taskId);
    }

    public boolean pause(long taskId) {
        requireExists(taskId);
        return scheduler.pause(taskId);
    }

    public boolean resume(long taskId) {
        requireExists(taskId);
        return scheduler.resume(taskId);
    }

    public int pauseAll() {
        return scheduler.pauseAll();
    }

    public int resumeAll() {
        return scheduler.resumeAll();
    }

    public int cancelAll() {
        return scheduler.cancelAll();
    }

    /**
     * Cancel the task if it is scheduled, then delete it with its files, outputs and logs.
     */
    public void delete(long taskId) {
        requireExists(taskId);
        if (scheduler.isScheduled(taskId)) {
            scheduler.cancel(taskId);
        }
        if (!tasks.delete(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        log.info("Task {} deleted", taskId);
        events.notify(TaskEvent.deleted(taskId));
    }

    public void updateOutputDir(long taskId, String outputDir) {
        if (outputDir == null || outputDir.isBlank()) {
            throw new ValidationException("outputDir is required");
        }
        if (!tasks.updateOutputDir(taskId, outputDir.trim())) {
            throw new TaskNotFoundException(taskId);
        }
        events.notify(TaskEvent.of(TaskEvent.Type.UPDATED, taskId, null));
    }

    // ==================== Cleanup ====================

    public int clearCompleted(int beforeDays) {
        if (beforeDays < 0) {
            throw new ValidationException("beforeDays must be >= 0");
        }
        return tasks.deleteCompleted(beforeDays);
    }

    public int clearFailed() {
        int deleted = tasks.deleteFailed();
        log.info("Cleared {} failed tasks", deleted);
        return deleted;
    }

    public int clearCancelled() {
        int deleted = tasks.deleteCancelled();
        log.info("Cleared {} cancelled tasks", deleted);
        return deleted;
    }

    // ==================== Logs ====================

    public List<TaskLog> getLogs(long taskId, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new ValidationException("limit and offset must be >= 0");
        }
        requireExists(taskId);
        return logs.findByTask(taskId, limit, offset);
    }

    public List<TaskLog> getRecentLogs(int limit) {
        if (limit < 0) {
            throw new ValidationException("limit must be >= 0");
        }
        return logs.findRecent(limit);
    }

    public int clearLogs(long taskId) {
        requireExists(taskId);
        return logs.deleteByTask(taskId);
    }

    public int clearAllLogs() {
        int deleted = logs.deleteAll();
        log.info("Cleared {} log lines", deleted);
        return deleted;
    }

    // ==================== Config ====================

    public TaskCenterSettings getConfig() {
        return settings.load();
    }

    /**
     * Validate and store a partial config update, then hand the new snapshot
     * to the scheduler.
     *
     * @param partial wire key to value
     * @throws ValidationException on unknown keys or bad values; nothing is stored then
     */
    public TaskCenterSettings setConfig(Map<String, Object> partial) {
        if (partial == null || partial.isEmpty()) {
            throw new ValidationException("config update is empty");
        }
        Map<String, Object> validated = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : partial.entrySet()) {
            SettingKey key = SettingKey.fromKey(entry.getKey());
            validated.put(key.key(), key.validate(entry.getValue()));
        }
        settings.setMany(validated);
        TaskCenterSettings snapshot = settings.load();
        scheduler.applySettings(snapshot);
        return snapshot;
    }

    public TaskCenterSettings resetConfig() {
        settings.resetToDefault();
        TaskCenterSettings snapshot = settings.load();
        scheduler.applySettings(snapshot);
        log.info("Config reset to defaults");
        return snapshot;
    }

    private void requireExists(long taskId) {
        if (tasks.findById(taskId).isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }
    }
}
