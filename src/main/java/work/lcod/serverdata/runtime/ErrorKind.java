package work.lcod.serverdata.runtime;

/**
 * Reasons a content load is aborted.
 */
public enum ErrorKind {
    /** A content file or record could not be parsed. */
    MALFORMED_RECORD,
    DUPLICATE_ID,
    /** A spawn, spawn group, zone or instance reference does not resolve. */
    DANGLING_REFERENCE,
    /** A player-only action is reachable from a non-player context. */
    CONTEXT_VIOLATION,
    /** A record parsed but breaks a rule of its category. */
    INVALID_RECORD,
    /** A script does not define the entry points its declared type requires. */
    SCRIPT_CONTRACT,
    /** An external collaborator rejected a definition. */
    EXTERNAL_REJECTED
}
