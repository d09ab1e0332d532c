package io.courier.core.handler;

import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.request.Command;
import io.smallrye.mutiny.Uni;

/// Handles one command type.
///
/// @param <C> the command type
@FunctionalInterface
public interface CommandHandler<C extends Command> {

    /// Executes a command.
    ///
    /// @param command the dispatched command, not null
    /// @param signal cancellation signal of the dispatch, not null
    /// @return `Uni` completing when the command has been handled, not null
    Uni<Void> handle(C command, CancellationSignal signal);
}
