package io.agentrelay.spec;

import static io.agentrelay.util.Utils.OBJECT_MAPPER;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class TaskDeserializationTest {

    @Test
    void testTaskWithMissingHistoryAndArtifacts() throws Exception {
        String json = """
            {
                "id": "task-123",
                "contextId": "context-456",
                "status": {
                    "state": "completed"
                },
                "kind": "task"
            }
            """;

        Task task = OBJECT_MAPPER.readValue(json, Task.class);

        assertNotNull(task.history(), "history should not be null");
        assertNotNull(task.artifacts(), "artifacts should not be null");
        assertTrue(task.history().isEmpty());
        assertTrue(task.artifacts().isEmpty());
        assertEquals(TaskState.COMPLETED, task.status().state());
        assertNotNull(task.status().timestamp(), "missing timestamp defaults to now");
    }

    @Test
    void testTaskWithExplicitNullValues() throws Exception {
        String json = """
            {
                "id": "task-123",
                "contextId": "context-456",
                "status": {
                    "state": "input-required"
                },
                "history": null,
                "artifacts": null,
                "kind": "task"
            }
            """;

        Task task = OBJECT_MAPPER.readValue(json, Task.class);

        assertNotNull(task.history());
        assertNotNull(task.artifacts());
        assertEquals(TaskState.INPUT_REQUIRED, task.status().state());
    }

    @Test
    void testTaskWithPopulatedArrays() throws Exception {
        String json = """
            {
                "id": "task-123",
                "contextId": "context-456",
                "status": {
                    "state": "working"
                },
                "history": [
                    {
                        "role": "user",
                        "parts": [{"kind": "text", "text": "hello"}],
                        "messageId": "msg-1",
                        "kind": "message"
                    }
                ],
                "artifacts": [
                    {
                        "artifactId": "artifact-1",
                        "parts": [{"kind": "data", "data": {"answer": 42}}]
                    }
                ],
                "kind": "task"
            }
            """;

        Task task = OBJECT_MAPPER.readValue(json, Task.class);

        assertEquals(1, task.history().size());
        Message message = task.history().get(0);
        assertEquals(Message.Role.USER, message.role());
        assertInstanceOf(TextPart.class, message.parts().get(0));
        assertEquals("hello", ((TextPart) message.parts().get(0)).text());

        assertEquals(1, task.artifacts().size());
        DataPart dataPart = assertInstanceOf(DataPart.class, task.artifacts().get(0).parts().get(0));
        assertEquals(42, dataPart.data().get("answer"));
    }
}
