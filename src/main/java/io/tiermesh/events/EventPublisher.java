package io.tiermesh.events;

import io.tiermesh.observability.AuditLogger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every core event in the audit log, then fans it out to subscribers in
 * registration order. A throwing subscriber is audited and does not stop delivery
 * to the others.
 */
public final class EventPublisher {
    private final AuditLogger auditLogger;
    private final List<EventListener> listeners;

    public EventPublisher(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public void subscribe(EventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(EventListener listener) {
        listeners.remove(listener);
    }

    public void publish(CoreEvent event) {
        Map<String, Object> details = new LinkedHashMap<>(event.attributes());
        details.put("subject", event.subject());
        details.put("event_ts_ms", event.timestampMs());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "event." + event.type(),
                "core",
                "events/" + event.subject(),
                "published",
                stringOrNull(event.attributes().get("job_id")),
                stringOrNull(event.attributes().get("record_id")),
                details
        ));
        for (EventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "event.listener_failed",
                        "core",
                        "events/" + event.subject(),
                        "error",
                        null,
                        null,
                        Map.of(
                                "event_type", event.type(),
                                "listener", listener.getClass().getName(),
                                "error", String.valueOf(e.getMessage())
                        )
                ));
            }
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
