package stitcher.taskcenter.model;

/**
 * Sort order for task listing, restricted to an allow-list of fields.
 */
public record TaskSort(Field field, boolean ascending) {

    public enum Field {
        CREATED_AT("createdAt", "created_at"),
        UPDATED_AT("updatedAt", "updated_at"),
        PRIORITY("priority", "priority"),
        PROGRESS("progress", "progress");

        private final String wireName;
        private final String column;

        Field(String wireName, String column) {
            this.wireName = wireName;
            this.column = column;
        }

        public String wireName() {
            return wireName;
        }

        public String column() {
            return column;
        }

        public static Field fromWire(String value) {
            for (Field f : values()) {
                if (f.wireName.equalsIgnoreCase(value)) {
                    return f;
                }
            }
            throw new ValidationException("unsupported sort field: " + value);
        }
    }

    public TaskSort {
        if (field == null) {
            field = Field.CREATED_AT;
        }
    }

    public static TaskSort newestFirst() {
        return new TaskSort(Field.CREATED_AT, false);
    }
}
