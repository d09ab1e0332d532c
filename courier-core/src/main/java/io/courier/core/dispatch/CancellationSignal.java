package io.courier.core.dispatch;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/// Cooperative cancellation token threaded through every dispatch.
///
/// The caller owns the signal and fires it with {@link #cancel()}. Handlers, behaviors
/// and validators receive it and may poll {@link #isCancelled()} or register a callback
/// with {@link #onCancel(Runnable)}. The engine itself observes the signal at the points
/// documented on {@link Mediator}.
///
/// ### Contracts
/// - **Invariant**: once cancelled, a signal stays cancelled
/// - **Invariant**: each registered callback runs at most once
/// - **Postcondition**: callbacks registered after cancellation run immediately on the
///   registering thread
///
/// @implNote Thread-safe. Callbacks run on the thread that calls {@link #cancel()}.
public final class CancellationSignal {

    private static final Logger LOG = Logger.getLogger(CancellationSignal.class);

    /// A signal that can never be cancelled. Used by the short dispatch overloads.
    public static final CancellationSignal NONE = new CancellationSignal(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /// Creates a new, not yet cancelled signal.
    ///
    /// @return fresh signal, never null
    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /// Fires the signal and runs every registered callback.
    ///
    /// Calling it again has no effect. A callback that throws is logged and does not
    /// prevent the remaining callbacks from running.
    ///
    /// @throws UnsupportedOperationException if called on {@link #NONE}
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationSignal.NONE cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Callback callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOG.warnv(e, "Cancellation callback failed: {0}", e.getMessage());
            }
        }
        callbacks.clear();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /// Throws if the signal has fired.
    ///
    /// @throws CancellationException if {@link #isCancelled()} is `true`
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /// Registers a callback to run when the signal fires.
    ///
    /// @param action the callback, not null
    /// @return handle that removes the callback, never null
    public Registration onCancel(Runnable action) {
        Objects.requireNonNull(action, "action must not be null");
        if (!cancellable) {
            return () -> {};
        }
        Callback callback = new Callback(action);
        callbacks.add(callback);
        if (isCancelled()) {
            callbacks.remove(callback);
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /// Races a `Uni` against this signal.
    ///
    /// When the signal fires before the operation produces an outcome, the returned `Uni`
    /// fails with {@link CancellationException} and the operation's subscription is
    /// cancelled. A signal already fired at subscription time fails immediately without
    /// subscribing to the operation.
    ///
    /// @param operation the operation to guard, not null
    /// @param <T> the item type
    /// @return guarded `Uni`, never null
    public <T> Uni<T> guard(Uni<T> operation) {
        if (!cancellable) {
            return operation;
        }
        return Uni.createFrom()
                .deferred(
                        () -> {
                            throwIfCancelled();
                            return Uni.combine().any().of(operation, this.<T>whenCancelled());
                        });
    }

    /// Stops a `Multi` at the first element boundary after this signal fires.
    ///
    /// The returned stream completes normally; upstream production is cancelled.
    ///
    /// @param stream the stream to guard, not null
    /// @param <T> the element type
    /// @return guarded stream, never null
    public <T> Multi<T> guard(Multi<T> stream) {
        if (!cancellable) {
            return stream;
        }
        return stream.select().first(item -> !isCancelled());
    }

    private <T> Uni<T> whenCancelled() {
        return Uni.createFrom()
                .emitter(
                        emitter -> {
                            Registration registration =
                                    onCancel(
                                            () ->
                                                    emitter.fail(
                                                            new CancellationException(
                                                                    "Operation was cancelled")));
                            emitter.onTermination(registration::unregister);
                        });
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "CancellationSignal[NONE]";
        }
        return "CancellationSignal[cancelled=" + isCancelled() + "]";
    }

    /// Handle returned by {@link #onCancel(Runnable)}.
    @FunctionalInterface
    public interface Registration {

        /// Removes the callback. Safe to call more than once and after the signal fired.
        void unregister();
    }

    private static final class Callback {
        private final Runnable action;
        private final AtomicBoolean ran = new AtomicBoolean();

        private Callback(Runnable action) {
            this.action = action;
        }

        private void run() {
            if (ran.compareAndSet(false, true)) {
                action.run();
            }
        }
    }
}
