package io.courier.core.result;

import io.smallrye.mutiny.Uni;

/// The zero-information value standing in for "no result".
///
/// Commands are routed through the same generically typed behavior chain as
/// queries, with `Unit` as their response type. There is exactly one instance,
/// equal only to itself.
public enum Unit {
    VALUE;

    /// Returns a `Uni` that emits {@link #VALUE}.
    ///
    /// @return completed `Uni`, never null
    public static Uni<Unit> item() {
        return Uni.createFrom().item(VALUE);
    }

    @Override
    public String toString() {
        return "()";
    }
}
