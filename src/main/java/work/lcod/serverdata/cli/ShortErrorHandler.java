package work.lcod.serverdata.cli;

import picocli.CommandLine;
import work.lcod.serverdata.runtime.ServerDataException;

/**
 * Prints a failed content load as one line naming the error kind; the stack trace only with
 * {@code -Dserverdata.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "serverdata.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable error) {
        if (error instanceof ServerDataException content) {
            return "[" + content.kind() + "] " + content.getMessage();
        }
        var root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            return root.getClass().getSimpleName();
        }
        return root == error ? message : error.getMessage() + ": " + message;
    }
}
