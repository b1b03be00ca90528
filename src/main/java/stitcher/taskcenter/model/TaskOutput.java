package stitcher.taskcenter.model;

import java.time.Instant;

/**
 * A file produced by a successful task.
 *
 * @param size bytes, null when unknown
 */
public record TaskOutput(Long id, String path, OutputKind kind, Long size, Instant createdAt) {

    public static TaskOutput of(String path, OutputKind kind, Long size) {
        return new TaskOutput(null, path, kind, size, null);
    }
}
