package io.shardguard.alert;

/**
 * Receives alerts on the monitoring thread. Implementations should return quickly or
 * hand work off; a slow callback delays every check after it in the same cycle.
 */
@FunctionalInterface
public interface AlertCallback {
    void onAlert(Alert alert) throws Exception;
}
