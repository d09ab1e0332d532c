package io.courier.core.request;

/// Marker for every message that can travel through a behavior chain.
///
/// Queries ({@link Request}), commands ({@link Command}) and stream requests
/// ({@link StreamRequest}) all extend this type. Notifications do not, since
/// behaviors never wrap a broadcast.
///
/// @see io.courier.core.pipeline.PipelineBehavior
public interface BaseRequest {}
