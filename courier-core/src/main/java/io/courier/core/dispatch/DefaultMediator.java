package io.courier.core.dispatch;

import io.courier.core.handler.CommandHandler;
import io.courier.core.handler.HandlerRegistry;
import io.courier.core.handler.NotificationHandler;
import io.courier.core.handler.RequestHandler;
import io.courier.core.handler.StreamRequestHandler;
import io.courier.core.pipeline.BehaviorPipeline;
import io.courier.core.pipeline.Continuation;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.BaseRequest;
import io.courier.core.request.Command;
import io.courier.core.request.Notification;
import io.courier.core.request.Request;
import io.courier.core.request.StreamRequest;
import io.courier.core.result.Unit;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.jboss.logging.Logger;

/// Default {@link Mediator} reading handlers and behaviors from a {@link HandlerRegistry}.
///
/// ### Dispatch of `send`
/// 1. Resolve the behaviors applicable to the runtime request type
/// 2. Build the terminal continuation, which resolves and invokes the handler
/// 3. Wrap it with the behaviors, first registered outermost ({@link BehaviorPipeline})
/// 4. Race the result against the cancellation signal
///
/// Handler resolution happens inside the terminal continuation. A behavior that answers
/// without calling its continuation (a cache hit) therefore succeeds even when no handler
/// is registered.
///
/// ### Notification fan-out
/// Every handler invocation is started without waiting for the others and the returned
/// `Uni` completes once all of them settled. When several handlers fail, the first failure
/// observed is propagated with the others attached as suppressed exceptions. No sibling is
/// cancelled because another failed. Behaviors are not applied to notifications.
///
/// @implNote Stateless apart from the registry and executor it was built with; safe for
/// concurrent use once the registry is fully populated.
///
/// @see io.courier.core.CourierFactory for assembling a mediator with the built-in behaviors
public class DefaultMediator implements Mediator {

    private static final Logger LOG = Logger.getLogger(DefaultMediator.class);

    private final HandlerRegistry registry;
    private final Executor notificationExecutor;

    /// Creates a mediator that subscribes notification handlers on the publishing thread.
    ///
    /// @param registry populated handler registry, not null
    public DefaultMediator(HandlerRegistry registry) {
        this(registry, null);
    }

    /// Creates a mediator with an executor for notification handler subscription.
    ///
    /// @param registry populated handler registry, not null
    /// @param notificationExecutor executor each notification handler is subscribed on, or
    ///     null to subscribe on the publishing thread
    public DefaultMediator(HandlerRegistry registry, Executor notificationExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.notificationExecutor = notificationExecutor;
    }

    @Override
    public <R> Uni<R> send(Request<R> request, CancellationSignal signal) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        Class<?> requestType = request.getClass();
        Continuation<R> terminal =
                () ->
                        Uni.createFrom()
                                .deferred(
                                        () -> {
                                            RequestHandler<Request<R>, R> handler =
                                                    registry.resolveRequestHandler(requestType);
                                            LOG.tracev(
                                                    "Invoking request handler for {0}",
                                                    requestType.getSimpleName());
                                            return handler.handle(request, signal);
                                        });
        return signal.guard(throughBehaviors(request, terminal, signal));
    }

    @Override
    public Uni<Void> send(Command command, CancellationSignal signal) {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        Class<?> commandType = command.getClass();
        Continuation<Unit> terminal =
                () ->
                        Uni.createFrom()
                                .deferred(
                                        () -> {
                                            CommandHandler<Command> handler =
                                                    registry.resolveCommandHandler(commandType);
                                            LOG.tracev(
                                                    "Invoking command handler for {0}",
                                                    commandType.getSimpleName());
                                            return handler.handle(command, signal)
                                                    .replaceWith(Unit.VALUE);
                                        });
        return signal.guard(throughBehaviors(command, terminal, signal)).replaceWithVoid();
    }

    @Override
    public Uni<Void> publish(Notification notification, CancellationSignal signal) {
        Objects.requireNonNull(notification, "notification must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        Class<?> notificationType = notification.getClass();
        return Uni.createFrom()
                .deferred(
                        () -> {
                            signal.throwIfCancelled();
                            List<NotificationHandler<Notification>> handlers =
                                    registry.resolveNotificationHandlers(notificationType);
                            if (handlers.isEmpty()) {
                                LOG.debugv(
                                        "No handlers for notification {0}",
                                        notificationType.getSimpleName());
                                return Uni.createFrom().voidItem();
                            }
                            return fanOut(notification, handlers, signal);
                        });
    }

    @Override
    public <R> Multi<R> stream(StreamRequest<R> request, CancellationSignal signal) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        Class<?> requestType = request.getClass();
        Multi<R> stream =
                Multi.createFrom()
                        .deferred(
                                () -> {
                                    if (signal.isCancelled()) {
                                        return Multi.createFrom().<R>empty();
                                    }
                                    StreamRequestHandler<StreamRequest<R>, R> handler =
                                            registry.resolveStreamHandler(requestType);
                                    return handler.handle(request, signal);
                                });
        return signal.guard(stream);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private <Q extends BaseRequest, R> Uni<R> throughBehaviors(
            Q request, Continuation<R> terminal, CancellationSignal signal) {
        return Uni.createFrom()
                .deferred(
                        () -> {
                            List<PipelineBehavior<Q, R>> behaviors =
                                    (List) registry.resolveBehaviors(request.getClass());
                            return new BehaviorPipeline<>(behaviors)
                                    .execute(request, terminal, signal);
                        });
    }

    private Uni<Void> fanOut(
            Notification notification,
            List<NotificationHandler<Notification>> handlers,
            CancellationSignal signal) {
        FanOutFailures failures = new FanOutFailures();
        List<Uni<Unit>> invocations = new ArrayList<>(handlers.size());
        for (NotificationHandler<Notification> handler : handlers) {
            invocations.add(invoke(handler, notification, signal, failures));
        }
        return Uni.join()
                .all(invocations)
                .andFailFast()
                .onItem()
                .transformToUni(
                        settled -> {
                            if (failures.count() > 0) {
                                LOG.debugv(
                                        "{0} of {1} handlers failed for notification {2}",
                                        failures.count(),
                                        settled.size(),
                                        notification.getClass().getSimpleName());
                            }
                            return failures.outcome();
                        });
    }

    private Uni<Unit> invoke(
            NotificationHandler<Notification> handler,
            Notification notification,
            CancellationSignal signal,
            FanOutFailures failures) {
        Uni<Void> invocation =
                Uni.createFrom().deferred(() -> handler.handle(notification, signal));
        if (notificationExecutor != null) {
            invocation = invocation.runSubscriptionOn(notificationExecutor);
        }
        return invocation
                .replaceWith(Unit.VALUE)
                .onFailure()
                .recoverWithItem(
                        failure -> {
                            failures.record(failure);
                            return Unit.VALUE;
                        });
    }
}
