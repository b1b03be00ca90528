package stitcher.taskcenter.api;

import io.netty.handler.codec.http.QueryStringDecoder;
import stitcher.taskcenter.model.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Typed access to query string parameters. Malformed values are validation errors.
 */
public final class QueryParams {

    private final Map<String, List<String>> params;

    private QueryParams(Map<String, List<String>> params) {
        this.params = params;
    }

    public static QueryParams of(String uri) {
        return new QueryParams(new QueryStringDecoder(uri).parameters());
    }

    public String string(String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(0);
        return value.isBlank() ? null : value.trim();
    }

    public int integer(String name, int fallback) {
        String value = string(name);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    public Long longValue(String name) {
        String value = string(name);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    public boolean bool(String name, boolean fallback) {
        String value = string(name);
        return value != null ? Boolean.parseBoolean(value) : fallback;
    }

    /** Comma separated list; repeated parameters are merged. */
    public List<String> list(String name) {
        List<String> values = params.get(name);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
