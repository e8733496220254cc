package work.lcod.serverdata.runtime;

/**
 * Fatal content error; aborts the whole load.
 */
public final class ServerDataException extends RuntimeException {
    private final ErrorKind kind;

    public ServerDataException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ServerDataException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
