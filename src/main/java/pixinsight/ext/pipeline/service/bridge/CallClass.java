package pixinsight.ext.pipeline.service.bridge;

/**
 * Polling budget classes for bridge calls. Short calls are bookkeeping
 * (listing, statistics, renames); long calls run engine processes.
 */
public enum CallClass {
    SHORT,
    LONG
}
