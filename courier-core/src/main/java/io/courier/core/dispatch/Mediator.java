package io.courier.core.dispatch;

import io.courier.core.request.Command;
import io.courier.core.request.Notification;
import io.courier.core.request.Request;
import io.courier.core.request.StreamRequest;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

/// Entry point for dispatching requests, commands, notifications and stream requests to
/// their registered handlers.
///
/// Every method returns a lazy Mutiny type: handler resolution and invocation happen on
/// subscription, and each subscription is an independent dispatch.
///
/// ### Cancellation
/// - `send`: the pipeline is raced against the signal; when it fires first the call fails
///   with {@link java.util.concurrent.CancellationException} and the pipeline's
///   subscription is cancelled
/// - `publish`: a signal fired before subscription fails the call without starting any
///   handler; started handlers are never abandoned and observe the signal themselves
/// - `stream`: production stops at the next element boundary and the stream completes
///
/// {@snippet :
/// String echoed = mediator.send(new Echo("hi")).await().indefinitely();
/// mediator.send(new DeleteUser("u-1")).await().indefinitely();
/// mediator.publish(new UserDeleted("u-1")).await().indefinitely();
/// List<Tick> ticks = mediator.stream(new Ticks(3)).collect().asList().await().indefinitely();
/// }
///
/// @see DefaultMediator
public interface Mediator {

    /// Dispatches a query to its handler through the applicable behaviors.
    ///
    /// @param request the query, not null
    /// @param <R> the response type
    /// @return lazy response, never null. Fails with
    ///     {@link io.courier.core.exception.HandlerNotFoundException} if the pipeline
    ///     reaches the handler and none is registered
    default <R> Uni<R> send(Request<R> request) {
        return send(request, CancellationSignal.NONE);
    }

    /// Dispatches a query with a cancellation signal.
    ///
    /// @param request the query, not null
    /// @param signal cancellation signal, not null
    /// @param <R> the response type
    /// @return lazy response, never null
    <R> Uni<R> send(Request<R> request, CancellationSignal signal);

    /// Dispatches a command to its handler through the applicable behaviors.
    ///
    /// @param command the command, not null
    /// @return `Uni` completing when the command is handled, never null
    default Uni<Void> send(Command command) {
        return send(command, CancellationSignal.NONE);
    }

    /// Dispatches a command with a cancellation signal.
    ///
    /// @param command the command, not null
    /// @param signal cancellation signal, not null
    /// @return `Uni` completing when the command is handled, never null
    Uni<Void> send(Command command, CancellationSignal signal);

    /// Broadcasts a notification to every registered handler concurrently.
    ///
    /// @param notification the notification, not null
    /// @return `Uni` completing after every handler settled, never null. With zero
    ///     handlers it completes immediately
    default Uni<Void> publish(Notification notification) {
        return publish(notification, CancellationSignal.NONE);
    }

    /// Broadcasts a notification with a cancellation signal.
    ///
    /// @param notification the notification, not null
    /// @param signal cancellation signal, not null
    /// @return `Uni` completing after every handler settled, never null
    Uni<Void> publish(Notification notification, CancellationSignal signal);

    /// Opens the stream produced by the handler of a stream request.
    ///
    /// @param request the stream request, not null
    /// @param <R> the element type
    /// @return lazy stream, never null
    default <R> Multi<R> stream(StreamRequest<R> request) {
        return stream(request, CancellationSignal.NONE);
    }

    /// Opens a stream with a cancellation signal.
    ///
    /// @param request the stream request, not null
    /// @param signal cancellation signal, not null
    /// @param <R> the element type
    /// @return lazy stream, never null
    <R> Multi<R> stream(StreamRequest<R> request, CancellationSignal signal);
}
