package io.courier.core.request;

/// A message broadcast to every handler registered for its type.
///
/// Zero handlers is a valid outcome for a notification. Behaviors are not applied
/// to notifications.
///
/// @see io.courier.core.handler.NotificationHandler
public interface Notification {}
