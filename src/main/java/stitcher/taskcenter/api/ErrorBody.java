package stitcher.taskcenter.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * {@code {"error": "..."}} bodies shared by the router and the controllers.
 */
public final class ErrorBody {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ErrorBody() {
    }

    public static String of(String message) {
        try {
            return MAPPER.writeValueAsString(Map.of("error", message != null ? message : ""));
        } catch (JsonProcessingException e) {
            // a single string field always serializes
            throw new IllegalStateException(e);
        }
    }
}
