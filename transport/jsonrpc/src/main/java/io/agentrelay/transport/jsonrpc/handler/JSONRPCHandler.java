package io.agentrelay.transport.jsonrpc.handler;

import static io.agentrelay.server.util.async.AsyncUtils.createTubeConfig;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.agentrelay.server.ExtendedAgentCard;
import io.agentrelay.server.PublicAgentCard;
import io.agentrelay.server.ServerCallContext;
import io.agentrelay.server.requesthandlers.RequestHandler;
import io.agentrelay.server.util.async.Internal;
import io.agentrelay.spec.A2AError;
import io.agentrelay.spec.AgentCard;
import io.agentrelay.spec.DeleteTaskPushNotificationConfigParams;
import io.agentrelay.spec.Event;
import io.agentrelay.spec.GetTaskPushNotificationConfigParams;
import io.agentrelay.spec.InternalError;
import io.agentrelay.spec.InvalidRequestError;
import io.agentrelay.spec.ListTaskPushNotificationConfigParams;
import io.agentrelay.spec.MessageSendParams;
import io.agentrelay.spec.PushNotificationNotSupportedError;
import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskIdParams;
import io.agentrelay.spec.TaskPushNotificationConfig;
import io.agentrelay.spec.TaskQueryParams;
import io.agentrelay.transport.jsonrpc.wrappers.JSONRPCRequest;
import io.agentrelay.transport.jsonrpc.wrappers.JSONRPCResponse;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps the {@link RequestHandler} operations into request/response envelopes.
 * <p>
 * Each operation answers with a {@link JSONRPCResponse} holding either the result or an error:
 * {@link A2AError}s keep their code, any other failure is reported as an {@link InternalError}.
 * Streaming operations answer with a publisher of envelopes, where a failure of the stream is
 * delivered as a last error envelope rather than through {@link Flow.Subscriber#onError}.
 * <p>
 * Operations the agent card does not advertise are refused: streaming with an
 * {@link InvalidRequestError}, push notification configs with a
 * {@link PushNotificationNotSupportedError}.
 */
@ApplicationScoped
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    // Fields set by constructor injection cannot be final. We need a noargs constructor for
    // Jakarta compatibility, and it seems that making fields set by constructor injection
    // final, is not proxyable in all runtimes
    private AgentCard agentCard;
    private @Nullable AgentCard extendedAgentCard;
    private RequestHandler requestHandler;
    private Executor executor;

    @SuppressWarnings("NullAway")
    protected JSONRPCHandler() {
        // For CDI proxy creation
        this.agentCard = null;
        this.requestHandler = null;
        this.executor = null;
    }

    @Inject
    public JSONRPCHandler(@PublicAgentCard AgentCard agentCard, @Nullable @ExtendedAgentCard AgentCard extendedAgentCard,
                          RequestHandler requestHandler, @Internal Executor executor) {
        this.agentCard = agentCard;
        this.extendedAgentCard = extendedAgentCard;
        this.requestHandler = requestHandler;
        this.executor = executor;
    }

    public JSONRPCHandler(@PublicAgentCard AgentCard agentCard, RequestHandler requestHandler, Executor executor) {
        this(agentCard, null, requestHandler, executor);
    }

    public JSONRPCResponse<Event> onMessageSend(JSONRPCRequest<MessageSendParams> request,
                                                @Nullable ServerCallContext context) {
        try {
            Event taskOrMessage = requestHandler.onMessageSend(request.params(), context);
            return JSONRPCResponse.success(request.id(), taskOrMessage);
        } catch (A2AError e) {
            return JSONRPCResponse.failure(request.id(), e);
        } catch (Throwable t) {
            return JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage()));
        }
    }

    public Flow.Publisher<JSONRPCResponse<Event>> onMessageSendStream(JSONRPCRequest<MessageSendParams> request,
                                                                      @Nullable ServerCallContext context) {
        if (!agentCard.capabilities().streaming()) {
            return ZeroPublisher.fromItems(JSONRPCResponse.failure(request.id(),
                    new InvalidRequestError("Streaming is not supported by the agent")));
        }
        try {
            Flow.Publisher<Event> publisher = requestHandler.onMessageSendStream(request.params(), context);
            return convertToStreamingResponse(request.id(), publisher);
        } catch (A2AError e) {
            return ZeroPublisher.fromItems(JSONRPCResponse.failure(request.id(), e));
        } catch (Throwable t) {
            return ZeroPublisher.fromItems(JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage())));
        }
    }

    public JSONRPCResponse<Task> onGetTask(JSONRPCRequest<TaskQueryParams> request, @Nullable ServerCallContext context) {
        try {
            return JSONRPCResponse.success(request.id(), requestHandler.onGetTask(request.params(), context));
        } catch (A2AError e) {
            return JSONRPCResponse.failure(request.id(), e);
        } catch (Throwable t) {
            return JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage()));
        }
    }

    public JSONRPCResponse<Task> onCancelTask(JSONRPCRequest<TaskIdParams> request, @Nullable ServerCallContext context) {
        try {
            return JSONRPCResponse.success(request.id(), requestHandler.onCancelTask(request.params(), context));
        } catch (A2AError e) {
            return JSONRPCResponse.failure(request.id(), e);
        } catch (Throwable t) {
            return JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage()));
        }
    }

    public Flow.Publisher<JSONRPCResponse<Event>> onResubscribeToTask(JSONRPCRequest<TaskIdParams> request,
                                                                      @Nullable ServerCallContext context) {
        if (!agentCard.capabilities().streaming()) {
            return ZeroPublisher.fromItems(JSONRPCResponse.failure(request.id(),
                    new InvalidRequestError("Streaming is not supported by the agent")));
        }
        try {
            Flow.Publisher<Event> publisher = requestHandler.onResubscribeToTask(request.params(), context);
            return convertToStreamingResponse(request.id(), publisher);
        } catch (A2AError e) {
            return ZeroPublisher.fromItems(JSONRPCResponse.failure(request.id(), e));
        } catch (Throwable t) {
            return ZeroPublisher.fromItems(JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage())));
        }
    }

    public JSONRPCResponse<TaskPushNotificationConfig> setPushNotificationConfig(
            JSONRPCRequest<TaskPushNotificationConfig> request, @Nullable ServerCallContext context) {
        if (!agentCard.capabilities().pushNotifications()) {
            return JSONRPCResponse.failure(request.id(), new PushNotificationNotSupportedError());
        }
        try {
            TaskPushNotificationConfig config = requestHandler.onSetTaskPushNotificationConfig(request.params(), context);
            return JSONRPCResponse.success(request.id(), config);
        } catch (A2AError e) {
            return JSONRPCResponse.failure(request.id(), e);
        } catch (Throwable t) {
            return JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage()));
        }
    }

    public JSONRPCResponse<TaskPushNotificationConfig> getPushNotificationConfig(
            JSONRPCRequest<GetTaskPushNotificationConfigParams> request, @Nullable ServerCallContext context) {
        if (!agentCard.capabilities().pushNotifications()) {
            return JSONRPCResponse.failure(request.id(), new PushNotificationNotSupportedError());
        }
        try {
            TaskPushNotificationConfig config = requestHandler.onGetTaskPushNotificationConfig(request.params(), context);
            return JSONRPCResponse.success(request.id(), config);
        } catch (A2AError e) {
            return JSONRPCResponse.failure(request.id(), e);
        } catch (Throwable t) {
            return JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage()));
        }
    }

    public JSONRPCResponse<List<TaskPushNotificationConfig>> listPushNotificationConfig(
            JSONRPCRequest<ListTaskPushNotificationConfigParams> request, @Nullable ServerCallContext context) {
        if (!agentCard.capabilities().pushNotifications()) {
            return JSONRPCResponse.failure(request.id(), new PushNotificationNotSupportedError());
        }
        try {
            List<TaskPushNotificationConfig> configs =
                    requestHandler.onListTaskPushNotificationConfig(request.params(), context);
            return JSONRPCResponse.success(request.id(), configs);
        } catch (A2AError e) {
            return JSONRPCResponse.failure(request.id(), e);
        } catch (Throwable t) {
            return JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage()));
        }
    }

    public JSONRPCResponse<Void> deletePushNotificationConfig(
            JSONRPCRequest<DeleteTaskPushNotificationConfigParams> request, @Nullable ServerCallContext context) {
        if (!agentCard.capabilities().pushNotifications()) {
            return JSONRPCResponse.failure(request.id(), new PushNotificationNotSupportedError());
        }
        try {
            requestHandler.onDeleteTaskPushNotificationConfig(request.params(), context);
            return JSONRPCResponse.success(request.id(), null);
        } catch (A2AError e) {
            return JSONRPCResponse.failure(request.id(), e);
        } catch (Throwable t) {
            return JSONRPCResponse.failure(request.id(), new InternalError(t.getMessage()));
        }
    }

    /**
     * Returns the card served to authenticated clients: the extended card when one is configured,
     * the public card otherwise.
     */
    // TODO: check the caller is authenticated once ServerCallContext users are populated by the transports
    public JSONRPCResponse<AgentCard> onGetExtendedCardRequest(Object requestId, @Nullable ServerCallContext context) {
        return JSONRPCResponse.success(requestId, extendedAgentCard != null ? extendedAgentCard : agentCard);
    }

    public AgentCard getAgentCard() {
        return agentCard;
    }

    private Flow.Publisher<JSONRPCResponse<Event>> convertToStreamingResponse(Object requestId,
                                                                             Flow.Publisher<Event> publisher) {
        // Errors are delivered as an error envelope, not through Subscriber.onError()
        return ZeroPublisher.create(createTubeConfig(), tube -> {
            AtomicReference<Flow.@Nullable Subscription> upstream = new AtomicReference<>();
            tube.whenCancelled(() -> {
                Flow.Subscription subscription = upstream.get();
                if (subscription != null) {
                    subscription.cancel();
                }
            });
            CompletableFuture.runAsync(() -> publisher.subscribe(new Flow.Subscriber<Event>() {
                @SuppressWarnings("NullAway")
                Flow.Subscription subscription;

                @Override
                public void onSubscribe(Flow.Subscription subscription) {
                    this.subscription = subscription;
                    upstream.set(subscription);
                    subscription.request(1);
                }

                @Override
                public void onNext(Event item) {
                    tube.send(JSONRPCResponse.success(requestId, item));
                    subscription.request(1);
                }

                @Override
                public void onError(Throwable throwable) {
                    LOGGER.debug("Event stream of request {} failed", requestId, throwable);
                    if (throwable instanceof A2AError error) {
                        tube.send(JSONRPCResponse.failure(requestId, error));
                    } else {
                        tube.send(JSONRPCResponse.failure(requestId, new InternalError(throwable.getMessage())));
                    }
                    onComplete();
                }

                @Override
                public void onComplete() {
                    tube.complete();
                }
            }), executor);
        });
    }
}
