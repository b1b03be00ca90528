package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PUT /api/v1/tasks/{id}/output-dir
 */
public record OutputDirRequest(@JsonProperty("outputDir") String outputDir) {
}
