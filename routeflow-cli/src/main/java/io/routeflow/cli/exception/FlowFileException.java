package io.routeflow.cli.exception;

import java.io.Serial;

/// Thrown when a flow or rule file cannot be loaded.
///
/// Common causes:
/// - File not found relative to the working directory
/// - File is not valid graph JSON
///
/// @see io.routeflow.cli.commands.FlowCommand
public class FlowFileException extends Exception {

    @Serial private static final long serialVersionUID = -2519046417235826063L;

    /// @param message description of why the file could not be loaded, not null
    public FlowFileException(String message) {
        super(message);
    }

    public FlowFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
