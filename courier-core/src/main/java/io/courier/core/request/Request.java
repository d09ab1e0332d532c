package io.courier.core.request;

/// A query routed to exactly one handler and answered with a value of type `R`.
///
/// Implementations should be immutable values; records are the natural fit.
/// The response type parameter is fixed by the implementing class, so a request
/// class alone identifies both sides of its handler signature.
///
/// {@snippet :
/// record GetUser(String id) implements Request<User> {}
/// }
///
/// @param <R> the response type
/// @see io.courier.core.handler.RequestHandler
public interface Request<R> extends BaseRequest {}
