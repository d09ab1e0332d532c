package io.courier.core.request;

/// A request that changes state and produces no meaningful result.
///
/// Commands go through the same behavior chain as queries; internally their
/// response type is {@link io.courier.core.result.Unit}.
///
/// @see io.courier.core.handler.CommandHandler
public interface Command extends BaseRequest {}
