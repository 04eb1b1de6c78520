package dev.devbase.manifest.cli;

import dev.devbase.manifest.manifest.ConfigurationMissingException;
import picocli.CommandLine;

/**
 * Keeps CLI failures to one line on stderr; {@code -Ddevbase.debug=true} or {@code --debug} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "devbase.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(message));
        if (ex instanceof ConfigurationMissingException) {
            err.println("Set DEVBASE_DOT or pass --manifest <packages.yaml>.");
        }
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
