package io.courier.core.handler;

import io.courier.core.exception.HandlerNotFoundException;
import io.courier.core.exception.HandlerNotFoundException.HandlerKind;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.BaseRequest;
import io.courier.core.request.Command;
import io.courier.core.request.Notification;
import io.courier.core.request.Request;
import io.courier.core.request.StreamRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/// Default mutable implementation of {@link HandlerRegistry}.
///
/// Registrations are stored in insertion-ordered maps; registration is not thread-safe
/// and must be completed before the registry is shared across threads. Resolution results
/// are memoized per runtime type in {@link ConcurrentHashMap}s, so repeated dispatches of
/// the same type skip the supertype search.
///
/// ### Contracts
/// - **Precondition**: all handlers and behaviors are registered before the first dispatch
/// - **Postcondition**: `resolve*` list methods never return null
/// - **Invariant**: every registration call clears the resolution memo
///
/// @implNote Not thread-safe for concurrent registration. Safe for concurrent resolution
/// after registration is complete.
///
/// @see HandlerRegistry
public class DefaultHandlerRegistry implements HandlerRegistry {

    private static final Logger LOG = Logger.getLogger(DefaultHandlerRegistry.class);

    private final TypeIndex<RequestHandler<?, ?>> requestHandlers = new TypeIndex<>();
    private final TypeIndex<CommandHandler<?>> commandHandlers = new TypeIndex<>();
    private final TypeIndex<StreamRequestHandler<?, ?>> streamHandlers = new TypeIndex<>();

    private final Map<Class<?>, Set<NotificationHandler<?>>> notificationHandlers =
            new LinkedHashMap<>();
    private final Map<Class<?>, List<NotificationHandler<Notification>>> notificationMemo =
            new ConcurrentHashMap<>();

    private final List<BehaviorRegistration> behaviors = new ArrayList<>();
    private final Map<Class<?>, List<PipelineBehavior<?, ?>>> behaviorMemo =
            new ConcurrentHashMap<>();

    @Override
    public <Q extends Request<R>, R> void registerRequestHandler(
            Class<Q> requestType, RequestHandler<Q, R> handler) {
        requestHandlers.put(requestType, handler);
    }

    @Override
    public <C extends Command> void registerCommandHandler(
            Class<C> commandType, CommandHandler<C> handler) {
        commandHandlers.put(commandType, handler);
    }

    @Override
    public <Q extends StreamRequest<R>, R> void registerStreamHandler(
            Class<Q> requestType, StreamRequestHandler<Q, R> handler) {
        streamHandlers.put(requestType, handler);
    }

    @Override
    public <N extends Notification> void registerNotificationHandler(
            Class<N> notificationType, NotificationHandler<N> handler) {
        Objects.requireNonNull(notificationType, "notificationType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        boolean added =
                notificationHandlers
                        .computeIfAbsent(notificationType, type -> new LinkedHashSet<>())
                        .add(handler);
        if (!added) {
            LOG.debugv(
                    "Notification handler already registered for {0}, ignoring duplicate",
                    notificationType.getSimpleName());
        }
        notificationMemo.clear();
    }

    @Override
    public void registerBehavior(PipelineBehavior<?, ?> behavior) {
        registerBehavior(BaseRequest.class, behavior);
    }

    @Override
    public void registerBehavior(
            Class<? extends BaseRequest> requestBound, PipelineBehavior<?, ?> behavior) {
        Objects.requireNonNull(requestBound, "requestBound must not be null");
        Objects.requireNonNull(behavior, "behavior must not be null");
        behaviors.add(new BehaviorRegistration(requestBound, behavior));
        behaviorMemo.clear();
        LOG.debugv(
                "Registered behavior {0} for {1} at position {2}",
                behavior.getClass().getSimpleName(),
                requestBound.getSimpleName(),
                behaviors.size());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> RequestHandler<Request<R>, R> resolveRequestHandler(Class<?> requestType) {
        return (RequestHandler<Request<R>, R>)
                requestHandlers
                        .resolve(requestType)
                        .orElseThrow(() -> notFound(requestType, HandlerKind.REQUEST));
    }

    @Override
    @SuppressWarnings("unchecked")
    public CommandHandler<Command> resolveCommandHandler(Class<?> commandType) {
        return (CommandHandler<Command>)
                commandHandlers
                        .resolve(commandType)
                        .orElseThrow(() -> notFound(commandType, HandlerKind.COMMAND));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> StreamRequestHandler<StreamRequest<R>, R> resolveStreamHandler(
            Class<?> requestType) {
        return (StreamRequestHandler<StreamRequest<R>, R>)
                streamHandlers
                        .resolve(requestType)
                        .orElseThrow(() -> notFound(requestType, HandlerKind.STREAM));
    }

    @Override
    public List<NotificationHandler<Notification>> resolveNotificationHandlers(
            Class<?> notificationType) {
        Objects.requireNonNull(notificationType, "notificationType must not be null");
        return notificationMemo.computeIfAbsent(
                notificationType, this::collectNotificationHandlers);
    }

    @Override
    public List<PipelineBehavior<?, ?>> resolveBehaviors(Class<?> requestType) {
        Objects.requireNonNull(requestType, "requestType must not be null");
        return behaviorMemo.computeIfAbsent(requestType, this::collectBehaviors);
    }

    private static HandlerNotFoundException notFound(Class<?> requestType, HandlerKind kind) {
        return new HandlerNotFoundException(requestType, kind);
    }

    @Override
    public boolean hasHandler(Class<?> requestType) {
        return requestHandlers.resolve(requestType).isPresent()
                || commandHandlers.resolve(requestType).isPresent()
                || streamHandlers.resolve(requestType).isPresent();
    }

    @SuppressWarnings("unchecked")
    private List<NotificationHandler<Notification>> collectNotificationHandlers(Class<?> type) {
        List<NotificationHandler<Notification>> matched = new ArrayList<>();
        for (Map.Entry<Class<?>, Set<NotificationHandler<?>>> entry :
                notificationHandlers.entrySet()) {
            if (entry.getKey().isAssignableFrom(type)) {
                for (NotificationHandler<?> handler : entry.getValue()) {
                    matched.add((NotificationHandler<Notification>) handler);
                }
            }
        }
        return List.copyOf(matched);
    }

    private List<PipelineBehavior<?, ?>> collectBehaviors(Class<?> type) {
        List<PipelineBehavior<?, ?>> matched = new ArrayList<>();
        for (BehaviorRegistration registration : behaviors) {
            if (registration.requestBound().isAssignableFrom(type)) {
                matched.add(registration.behavior());
            }
        }
        return List.copyOf(matched);
    }

    private record BehaviorRegistration(
            Class<? extends BaseRequest> requestBound, PipelineBehavior<?, ?> behavior) {}

    /// Single-handler index keyed by message type, with supertype fallback.
    private static final class TypeIndex<H> {

        private final Map<Class<?>, H> handlers = new LinkedHashMap<>();
        private final Map<Class<?>, Optional<H>> memo = new ConcurrentHashMap<>();

        void put(Class<?> type, H handler) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
            H previous = handlers.put(type, handler);
            memo.clear();
            if (previous != null && previous != handler) {
                LOG.debugv("Replaced handler for {0}", type.getSimpleName());
            }
        }

        Optional<H> resolve(Class<?> type) {
            Objects.requireNonNull(type, "type must not be null");
            return memo.computeIfAbsent(type, this::lookup);
        }

        private Optional<H> lookup(Class<?> type) {
            H exact = handlers.get(type);
            if (exact != null) {
                return Optional.of(exact);
            }
            for (Map.Entry<Class<?>, H> entry : handlers.entrySet()) {
                if (entry.getKey().isAssignableFrom(type)) {
                    return Optional.of(entry.getValue());
                }
            }
            return Optional.empty();
        }
    }
}
