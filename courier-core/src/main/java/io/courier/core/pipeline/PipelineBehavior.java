package io.courier.core.pipeline;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.request.BaseRequest;
import io.smallrye.mutiny.Uni;

/// A cross-cutting wrapper around handler execution.
///
/// A behavior receives the request and a {@link Continuation} for the remainder of the
/// pipeline. It decides whether to invoke the continuation, when, and how many times,
/// and may inspect or replace the item or failure it produces.
///
/// Three shapes are legal:
/// - **pass-through**: do work before and after `next.proceed()`
/// - **short-circuit**: return a `Uni` without calling `next` (cache hit, rejection)
/// - **retry/transform**: call `next` more than once, or remap its outcome
///
/// ### Contracts
/// - **Precondition**: `request`, `next` and `signal` are non-null
/// - **Postcondition**: returns a non-null `Uni`
/// - **Invariant**: failures not handled on purpose are propagated unchanged
///
/// {@snippet :
/// PipelineBehavior<BaseRequest, Object> audit = (request, next, signal) -> {
///     LOG.infov("Handling {0}", request.getClass().getSimpleName());
///     return next.proceed().onItem().invoke(response -> LOG.infov("Handled {0}", response));
/// };
/// }
///
/// @param <Q> the request types this behavior accepts
/// @param <R> the response type
/// @see BehaviorPipeline
/// @see io.courier.core.handler.HandlerRegistry#registerBehavior(Class, PipelineBehavior)
@FunctionalInterface
public interface PipelineBehavior<Q extends BaseRequest, R> {

    /// Handles the request, optionally delegating to the rest of the pipeline.
    ///
    /// @param request the dispatched request, not null
    /// @param next the rest of the pipeline, not null
    /// @param signal cancellation signal of the dispatch, not null
    /// @return lazy response, not null
    Uni<R> handle(Q request, Continuation<R> next, CancellationSignal signal);
}
