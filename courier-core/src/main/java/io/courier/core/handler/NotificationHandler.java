package io.courier.core.handler;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.request.Notification;
import io.smallrye.mutiny.Uni;

/// Reacts to one notification type. Any number may be registered per type.
///
/// @param <N> the notification type
@FunctionalInterface
public interface NotificationHandler<N extends Notification> {

    Uni<Void> handle(N notification, CancellationSignal signal);
}
