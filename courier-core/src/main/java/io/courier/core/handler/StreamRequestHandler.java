package io.courier.core.handler;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.request.StreamRequest;
import io.smallrye.mutiny.Multi;

/// Handles one stream request type by producing a lazy sequence of elements.
///
/// Implementations should produce elements on demand and stop once the
/// subscription is cancelled or the signal fires.
///
/// @param <Q> the stream request type
/// @param <R> the element type
@FunctionalInterface
public interface StreamRequestHandler<Q extends StreamRequest<R>, R> {

    Multi<R> handle(Q request, CancellationSignal signal);
}
