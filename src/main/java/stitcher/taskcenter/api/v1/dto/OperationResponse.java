package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for control operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("count") Integer count) {

    public static OperationResponse of(boolean ok) {
        return new OperationResponse(ok, null);
    }

    /** Bulk operation result */
    public static OperationResponse count(int count) {
        return new OperationResponse(true, count);
    }
}
