package io.shardguard.alert;

import io.shardguard.observability.AuditLogger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ordered observer list. {@link #publish(Alert)} calls every callback synchronously in
 * registration order; a failing callback is logged and skipped, never propagated.
 */
public final class AlertBus {
    private final List<AlertCallback> callbacks;
    private final AuditLogger auditLogger;
    private final AtomicLong published;
    private final AtomicLong callbackFailures;

    public AlertBus() {
        this(null);
    }

    public AlertBus(AuditLogger auditLogger) {
        this.callbacks = new CopyOnWriteArrayList<>();
        this.auditLogger = auditLogger;
        this.published = new AtomicLong(0L);
        this.callbackFailures = new AtomicLong(0L);
    }

    public void register(AlertCallback callback) {
        callbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public int callbackCount() {
        return callbacks.size();
    }

    /**
     * @return number of callbacks that failed for this alert
     */
    public int publish(Alert alert) {
        Objects.requireNonNull(alert, "alert");
        published.incrementAndGet();
        audit("alert.publish", alert, "ok", alert.toPayload());
        int failed = 0;
        int index = 0;
        for (AlertCallback callback : callbacks) {
            try {
                callback.onAlert(alert);
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Exception | Error e) {
                failed++;
                callbackFailures.incrementAndGet();
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("kind", alert.kind().wireName());
                details.put("callback_index", index);
                details.put("callback", callback.getClass().getName());
                details.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
                audit("alert.callback", alert, "error", details);
            }
            index++;
        }
        return failed;
    }

    public long publishedTotal() {
        return published.get();
    }

    public long callbackFailures() {
        return callbackFailures.get();
    }

    private void audit(String action, Alert alert, String result, Map<String, Object> details) {
        String resource = alert.shard() == null ? "environment" : "shard/" + alert.shard();
        if (auditLogger == null) {
            if (!"ok".equals(result)) {
                System.err.println("WARN " + action + " " + resource + " " + details);
            }
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.ofCycle(action, resource, result, alert.cycleId(), details));
        } catch (RuntimeException e) {
            System.err.println("WARN audit write failed for " + action + ": " + e.getMessage());
        }
    }
}
