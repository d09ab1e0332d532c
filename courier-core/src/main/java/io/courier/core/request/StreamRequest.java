package io.courier.core.request;

/// A request answered by a lazily produced sequence of `R` elements.
///
/// @param <R> the element type
/// @see io.courier.core.handler.StreamRequestHandler
public interface StreamRequest<R> extends BaseRequest {}
