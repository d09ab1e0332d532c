package io.courier.core.handler;

import io.courier.core.exception.HandlerNotFoundException;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.BaseRequest;
import io.courier.core.request.Command;
import io.courier.core.request.Notification;
import io.courier.core.request.Request;
import io.courier.core.request.StreamRequest;
import java.util.List;

/// Registry mapping message types to their handlers and to the behaviors that wrap them.
///
/// Populated through explicit registration calls; the dispatch engine only reads from it.
///
/// ### Resolution rules
/// - Request, command and stream handlers: the handler registered for the exact runtime
///   type, otherwise the first registration (in registration order) for a supertype of it.
///   Registering a type twice replaces the earlier handler.
/// - Notification handlers: every handler registered for the runtime type or any of its
///   supertypes, in registration order. The same handler instance is kept once per type.
/// - Behaviors: every behavior whose bound accepts the runtime type, in registration order.
///
/// A request class fixes its response type through `Request<R>`, so keying by request
/// type is equivalent to keying by the request/response pair. Commands resolve with
/// response type {@link io.courier.core.result.Unit}.
///
/// @see DefaultHandlerRegistry
public interface HandlerRegistry {

    /// Registers the handler for a query type, replacing any earlier registration.
    ///
    /// @param requestType the query class, not null
    /// @param handler the handler, not null
    /// @param <Q> the query type
    /// @param <R> the response type
    <Q extends Request<R>, R> void registerRequestHandler(
            Class<Q> requestType, RequestHandler<Q, R> handler);

    /// Registers the handler for a command type, replacing any earlier registration.
    ///
    /// @param commandType the command class, not null
    /// @param handler the handler, not null
    /// @param <C> the command type
    <C extends Command> void registerCommandHandler(
            Class<C> commandType, CommandHandler<C> handler);

    /// Registers the handler for a stream request type, replacing any earlier registration.
    ///
    /// @param requestType the stream request class, not null
    /// @param handler the handler, not null
    /// @param <Q> the stream request type
    /// @param <R> the element type
    <Q extends StreamRequest<R>, R> void registerStreamHandler(
            Class<Q> requestType, StreamRequestHandler<Q, R> handler);

    /// Adds a handler for a notification type.
    ///
    /// @param notificationType the notification class, not null
    /// @param handler the handler, not null
    /// @param <N> the notification type
    <N extends Notification> void registerNotificationHandler(
            Class<N> notificationType, NotificationHandler<N> handler);

    /// Appends a behavior applied to every request, command and query alike.
    ///
    /// @param behavior the behavior, not null. Must accept any request and be generic in
    ///     its response type
    void registerBehavior(PipelineBehavior<?, ?> behavior);

    /// Appends a behavior applied to requests assignable to `requestBound`.
    ///
    /// @param requestBound the most general request type the behavior accepts, not null
    /// @param behavior the behavior, not null
    void registerBehavior(
            Class<? extends BaseRequest> requestBound, PipelineBehavior<?, ?> behavior);

    /// Resolves the single handler for a query type.
    ///
    /// @param requestType runtime class of the query, not null
    /// @param <R> the response type
    /// @return the handler, never null
    /// @throws HandlerNotFoundException if no handler is registered
    <R> RequestHandler<Request<R>, R> resolveRequestHandler(Class<?> requestType);

    /// Resolves the single handler for a command type.
    ///
    /// @param commandType runtime class of the command, not null
    /// @return the handler, never null
    /// @throws HandlerNotFoundException if no handler is registered
    CommandHandler<Command> resolveCommandHandler(Class<?> commandType);

    /// Resolves the single handler for a stream request type.
    ///
    /// @param requestType runtime class of the stream request, not null
    /// @param <R> the element type
    /// @return the handler, never null
    /// @throws HandlerNotFoundException if no handler is registered
    <R> StreamRequestHandler<StreamRequest<R>, R> resolveStreamHandler(Class<?> requestType);

    /// Resolves all handlers for a notification type.
    ///
    /// @param notificationType runtime class of the notification, not null
    /// @return ordered handlers, empty if none, never null
    List<NotificationHandler<Notification>> resolveNotificationHandlers(
            Class<?> notificationType);

    /// Resolves the behaviors applicable to a request type.
    ///
    /// @param requestType runtime class of the request or command, not null
    /// @return behaviors in registration order, empty if none, never null
    List<PipelineBehavior<?, ?>> resolveBehaviors(Class<?> requestType);

    /// Returns whether a request, command or stream handler resolves for the type.
    ///
    /// @param requestType the type to check, not null
    /// @return `true` if dispatching the type would find a handler
    boolean hasHandler(Class<?> requestType);
}
