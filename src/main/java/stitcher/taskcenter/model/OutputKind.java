package stitcher.taskcenter.model;

import java.util.Locale;
import java.util.Set;

/**
 * Media kind of a produced output file.
 */
public enum OutputKind {
    VIDEO,
    IMAGE,
    OTHER;

    private static final Set<String> VIDEO_EXT = Set.of("mp4", "mov", "mkv", "avi", "webm", "flv", "m4v");
    private static final Set<String> IMAGE_EXT = Set.of("jpg", "jpeg", "png", "webp", "bmp", "gif", "tiff");

    public String wireName() {
        return name().toLowerCase();
    }

    public static OutputKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        for (OutputKind k : values()) {
            if (k.wireName().equalsIgnoreCase(value.trim())) {
                return k;
            }
        }
        return OTHER;
    }

    /** Guess the kind from a file name extension. */
    public static OutputKind fromFileName(String fileName) {
        if (fileName == null) {
            return OTHER;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return OTHER;
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (VIDEO_EXT.contains(ext)) {
            return VIDEO;
        }
        if (IMAGE_EXT.contains(ext)) {
            return IMAGE;
        }
        return OTHER;
    }
}
