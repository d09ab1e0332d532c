package io.courier.core.handler;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.request.Request;
import io.smallrye.mutiny.Uni;

/// Handles one query type.
///
/// Registered with {@link HandlerRegistry#registerRequestHandler(Class, RequestHandler)}; the
/// registration captures the request type so dispatch never inspects handler
/// signatures.
///
/// @param <Q> the query type
/// @param <R> the response type
@FunctionalInterface
public interface RequestHandler<Q extends Request<R>, R> {

    /// Produces the response for a query.
    ///
    /// @param request the dispatched query, not null
    /// @param signal cancellation signal of the dispatch, not null
    /// @return lazy response, not null
    Uni<R> handle(Q request, CancellationSignal signal);
}
