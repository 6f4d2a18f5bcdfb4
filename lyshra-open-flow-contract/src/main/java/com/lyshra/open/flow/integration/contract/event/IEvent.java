package com.lyshra.open.flow.integration.contract.event;

import java.time.Instant;
import java.util.Map;

public interface IEvent {
    String getId();
    Instant getTime();
    String getChannel();
    String getSource();
    String getType();
    String getCorrelationId();
    Map<String, Object> getData();
}
