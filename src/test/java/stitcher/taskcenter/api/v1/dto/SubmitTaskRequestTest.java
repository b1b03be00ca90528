package stitcher.taskcenter.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import stitcher.taskcenter.service.TaskSubmission;

import static org.junit.jupiter.api.Assertions.*;

class SubmitTaskRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "type": "video_stitch",
                  "name": "A+B",
                  "outputDir": "/videos/out",
                  "config": { "transition": "fade", "duration": 1.5 },
                  "files": [
                    { "path": "/videos/a.mp4", "category": "A", "categoryLabel": "Intro" },
                    { "path": "/videos/b.mp4", "category": "B" }
                  ],
                  "priority": 5
                }
                """;

        TaskSubmission submission = mapper.readValue(json, SubmitTaskRequest.class).toSubmission();

        assertEquals("video_stitch", submission.type());
        assertEquals("A+B", submission.name());
        assertEquals(5, submission.priority());
        assertNull(submission.maxRetry());
        assertEquals(2, submission.files().size());
        assertEquals("Intro", submission.files().get(0).categoryLabel());
        assertNull(submission.files().get(1).categoryLabel());
        assertEquals("{\"transition\":\"fade\",\"duration\":1.5}", submission.config());
    }

    @Test
    void missingConfigAndFiles() throws Exception {
        TaskSubmission submission = mapper.readValue("{\"type\":\"cover_format\",\"config\":null}",
                SubmitTaskRequest.class).toSubmission();

        assertNull(submission.config());
        assertNull(submission.files());
    }
}
