package com.lyshra.open.flow.integration.models.events;

import com.lyshra.open.flow.integration.contract.event.IEvent;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Lifecycle notification published on the event bus.
 *
 * <pre>{@code
 * Event event = Event.builder()
 *     .channel("workflow-runs")
 *     .type("workflow_finished")
 *     .data(Map.of("workflow", "w1", "state", "failed"))
 *     .build();
 * }</pre>
 */
@Data
@Builder(toBuilder = true)
public class Event implements IEvent, Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private final String id = UUID.randomUUID().toString();

    @Builder.Default
    private final Instant time = Instant.now();

    private final String channel;
    private final String source;
    private final String type;
    private final String correlationId;

    @Builder.Default
    private final Map<String, Object> data = Collections.emptyMap();

    /**
     * Document form used for path resolution by condition rules. Keys use the wire
     * spelling ({@code correlation_id}); {@code time} is ISO-8601.
     */
    public static Map<String, Object> toMap(IEvent event) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", event.getId());
        map.put("time", event.getTime() == null ? null : event.getTime().toString());
        map.put("channel", event.getChannel());
        map.put("source", event.getSource());
        map.put("type", event.getType());
        map.put("correlation_id", event.getCorrelationId());
        map.put("data", event.getData());
        return map;
    }

    public Map<String, Object> toMap() {
        return toMap(this);
    }
}
