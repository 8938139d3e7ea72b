package dora.chatsync.store;

/**
 * Which branch of the duplicate check an ingested message took.
 */
public enum IngestOutcome {
    /** A record with the same server id existed and was overwritten. */
    UPDATED,
    /** The message was the echo of a local record, which now carries the server id. */
    RECONCILED,
    /** No match, the message was added as a new record. */
    APPENDED
}
