package stitcher.taskcenter.model;

/**
 * Supported job kinds.
 */
public enum TaskType {
    VIDEO_MERGE("video_merge", "Landscape/portrait merge"),
    VIDEO_STITCH("video_stitch", "A+B stitch"),
    VIDEO_RESIZE("video_resize", "Smart resize"),
    IMAGE_MATERIAL("image_material", "Image material"),
    COVER_FORMAT("cover_format", "Cover format conversion"),
    COVER_COMPRESS("cover_compress", "Cover compression"),
    LOSSLESS_GRID("lossless_grid", "Lossless grid");

    private final String wireName;
    private final String displayName;

    TaskType(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    /** Every media job works on at least one input file. */
    public boolean requiresInputs() {
        return true;
    }

    public static TaskType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("type is required");
        }
        for (TaskType t : values()) {
            if (t.wireName.equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        throw new ValidationException("unknown task type: " + value);
    }
}
