package com.jarvis.core.health;

import com.jarvis.core.events.EventBus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the event bus transport connection.
 */
@Component
public class EventBusHealthIndicator implements HealthIndicator {

    private final EventBus eventBus;

    public EventBusHealthIndicator(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public Health health() {
        var builder = eventBus.isConnected() ? Health.up() : Health.down();
        return builder.withDetail("transport", eventBus.transportName()).build();
    }
}
