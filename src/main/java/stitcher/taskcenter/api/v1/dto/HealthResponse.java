package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import stitcher.taskcenter.model.QueueStatus;

/**
 * Response DTO for health check endpoint.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("queue") QueueStatus queue) {

    public static HealthResponse healthy(String uptime, String version, QueueStatus queue) {
        return new HealthResponse("UP", "connected", uptime, version, queue);
    }

    public static HealthResponse unhealthy(String dbError) {
        return new HealthResponse("DOWN", "error: " + dbError, null, null, null);
    }
}
