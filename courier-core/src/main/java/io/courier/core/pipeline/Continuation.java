package io.courier.core.pipeline;

import io.smallrye.mutiny.Uni;

/// The rest of the pipeline as seen from one behavior: the remaining behaviors followed
/// by the handler.
///
/// Each call to {@link #proceed()} returns a new lazy `Uni`; subscribing to it runs the
/// inner pipeline once. Subscribing twice (or calling `proceed()` twice) runs it twice.
///
/// @param <R> the response type
@FunctionalInterface
public interface Continuation<R> {

    Uni<R> proceed();
}
