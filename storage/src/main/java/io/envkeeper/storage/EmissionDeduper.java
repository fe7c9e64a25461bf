package io.envkeeper.storage;

/**
 * Deduplicates event emissions by key.
 * Rationale:
 *  - A transition can be reported more than once: a retried call, a probe and
 *    a recovery racing on the same change, or a replay after restart.
 *  - Each real transition must reach the event log exactly once.
 * <p>
 * Keys are derived from the session id and the session version that the
 * transition produced, so they are stable across retries.
 */
public interface EmissionDeduper {

    /** Returns true if this key was not seen before and is now recorded. */
    boolean firstTime(String key);

    /** Record a key as seen without asking (used when seeding from the log). */
    void remember(String key);

    /** Drop a key whose emission did not make it to the log, so a retry is not suppressed. */
    void forget(String key);
}
