package io.courier.core.pipeline;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.request.BaseRequest;
import io.smallrye.mutiny.Uni;
import java.util.List;

/// Composes an ordered list of {@link PipelineBehavior}s around a terminal continuation.
///
/// The list is folded from last to first, so the first behavior becomes the outermost
/// wrapper: it runs first on the way in and last on the way out.
///
/// ### Contracts
/// - **Precondition**: `behaviors` list is non-null (may be empty)
/// - **Postcondition**: with no behaviors, the composed continuation is the terminal one
/// - **Invariant**: behaviors are entered in list order; a behavior that does not call
///   its continuation prevents every inner behavior and the terminal from running
///
/// @implNote Stateless and thread-safe. The behavior list is copied at construction
/// time. Every step is wrapped in a deferred `Uni`, so nothing runs until subscription
/// and an exception thrown synchronously by a behavior becomes a failure.
///
/// @see PipelineBehavior for individual behavior contract
public final class BehaviorPipeline<Q extends BaseRequest, R> {

    private final List<PipelineBehavior<Q, R>> behaviors;

    /// Creates a pipeline with the given behaviors.
    ///
    /// @param behaviors ordered list of behaviors, outermost first, not null
    public BehaviorPipeline(List<PipelineBehavior<Q, R>> behaviors) {
        this.behaviors = List.copyOf(behaviors);
    }

    /// Wraps `terminal` with every behavior.
    ///
    /// @param request the dispatched request, not null
    /// @param terminal continuation invoking the handler, not null
    /// @param signal cancellation signal of the dispatch, not null
    /// @return the outermost continuation, never null
    public Continuation<R> compose(Q request, Continuation<R> terminal, CancellationSignal signal) {
        Continuation<R> next = terminal;
        for (int i = behaviors.size() - 1; i >= 0; i--) {
            PipelineBehavior<Q, R> behavior = behaviors.get(i);
            Continuation<R> inner = next;
            next = () -> Uni.createFrom().deferred(() -> behavior.handle(request, inner, signal));
        }
        return next;
    }

    /// Composes the pipeline and returns the outermost `Uni`.
    ///
    /// @param request the dispatched request, not null
    /// @param terminal continuation invoking the handler, not null
    /// @param signal cancellation signal of the dispatch, not null
    /// @return lazy response, never null
    public Uni<R> execute(Q request, Continuation<R> terminal, CancellationSignal signal) {
        return compose(request, terminal, signal).proceed();
    }

    public int size() {
        return behaviors.size();
    }
}
