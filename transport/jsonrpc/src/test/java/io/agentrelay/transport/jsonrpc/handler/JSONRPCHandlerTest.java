package io.agentrelay.transport.jsonrpc.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentrelay.server.ServerCallContext;
import io.agentrelay.server.requesthandlers.RequestHandler;
import io.agentrelay.spec.A2AErrorCodes;
import io.agentrelay.spec.AgentCapabilities;
import io.agentrelay.spec.AgentCard;
import io.agentrelay.spec.Event;
import io.agentrelay.spec.ListTaskPushNotificationConfigParams;
import io.agentrelay.spec.Message;
import io.agentrelay.spec.MessageSendParams;
import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskIdParams;
import io.agentrelay.spec.TaskNotFoundError;
import io.agentrelay.spec.TaskQueryParams;
import io.agentrelay.spec.TaskState;
import io.agentrelay.spec.TaskStatus;
import io.agentrelay.spec.TaskStatusUpdateEvent;
import io.agentrelay.spec.TextPart;
import io.agentrelay.transport.jsonrpc.wrappers.JSONRPCRequest;
import io.agentrelay.transport.jsonrpc.wrappers.JSONRPCResponse;
import io.agentrelay.util.Utils;
import mutiny.zero.ZeroPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class JSONRPCHandlerTest {

    private static final AgentCard CARD = createAgentCard(true, true);

    private static final ServerCallContext NULL_CONTEXT = null;

    private static final Task MINIMAL_TASK = Task.builder()
            .id("task-123")
            .contextId("session-xyz")
            .status(new TaskStatus(TaskState.SUBMITTED))
            .build();

    private static final Message MESSAGE = Message.builder()
            .messageId("111")
            .role(Message.Role.USER)
            .parts(new TextPart("test message"))
            .build();

    @Mock
    private RequestHandler requestHandler;

    private final ExecutorService internalExecutor = Executors.newCachedThreadPool();
    private AutoCloseable mocks;

    @BeforeEach
    public void init() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterEach
    public void cleanup() throws Exception {
        mocks.close();
        internalExecutor.shutdownNow();
    }

    @Test
    public void testOnMessageSendSuccess() {
        JSONRPCHandler handler = new JSONRPCHandler(CARD, requestHandler, internalExecutor);
        when(requestHandler.onMessageSend(any(), any())).thenReturn(MINIMAL_TASK);

        JSONRPCResponse<Event> response = handler.onMessageSend(
                new JSONRPCRequest<>("1", new MessageSendParams(MESSAGE)), NULL_CONTEXT);

        assertEquals("1", response.id());
        assertSame(MINIMAL_TASK, response.result());
        assertFalse(response.failed());
    }

    @Test
    public void testProtocolErrorKeepsItsCode() {
        JSONRPCHandler handler = new JSONRPCHandler(CARD, requestHandler, internalExecutor);
        when(requestHandler.onGetTask(any(), any())).thenThrow(new TaskNotFoundError());

        JSONRPCResponse<Task> response = handler.onGetTask(
                new JSONRPCRequest<>(7, new TaskQueryParams("missing")), NULL_CONTEXT);

        assertTrue(response.failed());
        assertNull(response.result());
        assertEquals(7, response.id());
        assertEquals(A2AErrorCodes.TASK_NOT_FOUND_ERROR_CODE, response.error().code());
    }

    @Test
    public void testUnexpectedFailureBecomesInternalError() {
        JSONRPCHandler handler = new JSONRPCHandler(CARD, requestHandler, internalExecutor);
        when(requestHandler.onCancelTask(any(), any())).thenThrow(new IllegalStateException("store offline"));

        JSONRPCResponse<Task> response = handler.onCancelTask(
                new JSONRPCRequest<>("1", new TaskIdParams("task-123")), NULL_CONTEXT);

        assertEquals(A2AErrorCodes.INTERNAL_ERROR_CODE, response.error().code());
        assertEquals("store offline", response.error().message());
    }

    @Test
    public void testStreamingNotSupported() throws Exception {
        JSONRPCHandler handler = new JSONRPCHandler(createAgentCard(false, true), requestHandler, internalExecutor);

        List<JSONRPCResponse<Event>> responses = collect(handler.onMessageSendStream(
                new JSONRPCRequest<>("1", new MessageSendParams(MESSAGE)), NULL_CONTEXT));
        List<JSONRPCResponse<Event>> resubscribe = collect(handler.onResubscribeToTask(
                new JSONRPCRequest<>("2", new TaskIdParams("task-123")), NULL_CONTEXT));

        assertEquals(1, responses.size());
        assertEquals(A2AErrorCodes.INVALID_REQUEST_ERROR_CODE, responses.get(0).error().code());
        assertEquals(A2AErrorCodes.INVALID_REQUEST_ERROR_CODE, resubscribe.get(0).error().code());
        verifyNoInteractions(requestHandler);
    }

    @Test
    public void testPushNotificationsNotSupported() {
        JSONRPCHandler handler = new JSONRPCHandler(createAgentCard(true, false), requestHandler, internalExecutor);

        JSONRPCResponse<?> response = handler.listPushNotificationConfig(
                new JSONRPCRequest<>("1", new ListTaskPushNotificationConfigParams("task-123")), NULL_CONTEXT);

        assertEquals(A2AErrorCodes.PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE, response.error().code());
        verifyNoInteractions(requestHandler);
    }

    @Test
    public void testStreamingWrapsEveryEvent() throws Exception {
        JSONRPCHandler handler = new JSONRPCHandler(CARD, requestHandler, internalExecutor);
        TaskStatusUpdateEvent completed = TaskStatusUpdateEvent.builder()
                .taskId(MINIMAL_TASK.id())
                .contextId(MINIMAL_TASK.contextId())
                .status(new TaskStatus(TaskState.COMPLETED))
                .isFinal(true)
                .build();
        when(requestHandler.onMessageSendStream(any(), any()))
                .thenReturn(ZeroPublisher.fromItems(MINIMAL_TASK, completed));

        List<JSONRPCResponse<Event>> responses = collect(handler.onMessageSendStream(
                new JSONRPCRequest<>("1", new MessageSendParams(MESSAGE)), NULL_CONTEXT));

        assertEquals(2, responses.size());
        assertSame(MINIMAL_TASK, responses.get(0).result());
        assertSame(completed, responses.get(1).result());
        responses.forEach(response -> assertEquals("1", response.id()));
    }

    @Test
    public void testStreamFailureEndsWithErrorEnvelope() throws Exception {
        JSONRPCHandler handler = new JSONRPCHandler(CARD, requestHandler, internalExecutor);
        when(requestHandler.onResubscribeToTask(any(), any()))
                .thenReturn(ZeroPublisher.fromFailure(new IllegalStateException("agent crashed")));

        List<JSONRPCResponse<Event>> responses = collect(handler.onResubscribeToTask(
                new JSONRPCRequest<>("1", new TaskIdParams("task-123")), NULL_CONTEXT));

        assertEquals(1, responses.size());
        assertEquals(A2AErrorCodes.INTERNAL_ERROR_CODE, responses.get(0).error().code());
    }

    @Test
    public void testExtendedCardFallsBackToPublicCard() {
        AgentCard extended = AgentCard.builder()
                .name("test-card-extended")
                .url("http://example.com")
                .version("1.0")
                .capabilities(new AgentCapabilities(true, true))
                .build();

        JSONRPCHandler withoutExtended = new JSONRPCHandler(CARD, requestHandler, internalExecutor);
        JSONRPCHandler withExtended = new JSONRPCHandler(CARD, extended, requestHandler, internalExecutor);

        assertSame(CARD, withoutExtended.onGetExtendedCardRequest("1", NULL_CONTEXT).result());
        assertSame(extended, withExtended.onGetExtendedCardRequest("1", NULL_CONTEXT).result());
        assertSame(CARD, withExtended.getAgentCard());
    }

    @Test
    public void testEnvelopeSerialization() throws Exception {
        JsonNode success = Utils.OBJECT_MAPPER.readTree(
                Utils.toJsonString(JSONRPCResponse.success("1", MINIMAL_TASK)));
        assertEquals("2.0", success.get("jsonrpc").asText());
        assertEquals("task", success.get("result").get("kind").asText());
        assertFalse(success.has("error"));

        JsonNode failure = Utils.OBJECT_MAPPER.readTree(
                Utils.toJsonString(JSONRPCResponse.failure(3, new TaskNotFoundError())));
        assertEquals(3, failure.get("id").asInt());
        assertEquals(A2AErrorCodes.TASK_NOT_FOUND_ERROR_CODE, failure.get("error").get("code").asInt());
        assertEquals("Task not found", failure.get("error").get("message").asText());
        assertFalse(failure.has("result"));
        assertFalse(failure.get("error").has("data"));
    }

    private static <T> List<T> collect(Flow.Publisher<T> publisher) throws InterruptedException {
        List<T> items = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        publisher.subscribe(new Flow.Subscriber<T>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(T item) {
                synchronized (items) {
                    items.add(item);
                }
            }

            @Override
            public void onError(Throwable throwable) {
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });
        assertTrue(done.await(5, TimeUnit.SECONDS), "stream did not terminate");
        synchronized (items) {
            return List.copyOf(items);
        }
    }

    private static AgentCard createAgentCard(boolean streaming, boolean pushNotifications) {
        return AgentCard.builder()
                .name("test-card")
                .description("A test agent card")
                .url("http://example.com")
                .version("1.0")
                .capabilities(new AgentCapabilities(streaming, pushNotifications))
                .build();
    }
}
