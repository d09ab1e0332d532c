package io.courier.core.dispatch;

import io.smallrye.mutiny.Uni;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/// Collects handler failures of one notification fan-out in the order they are observed.
///
/// The first failure recorded is the one reported to the caller; later ones are attached
/// to it as suppressed exceptions.
final class FanOutFailures {

    private final Queue<Throwable> failures = new ConcurrentLinkedQueue<>();

    void record(Throwable failure) {
        failures.add(failure);
    }

    int count() {
        return failures.size();
    }

    /// Returns a completed `Uni` when nothing failed, otherwise a `Uni` failing with the
    /// first recorded failure.
    Uni<Void> outcome() {
        Throwable first = failures.poll();
        if (first == null) {
            return Uni.createFrom().voidItem();
        }
        Throwable next;
        while ((next = failures.poll()) != null) {
            if (next != first) {
                first.addSuppressed(next);
            }
        }
        return Uni.createFrom().failure(first);
    }
}
