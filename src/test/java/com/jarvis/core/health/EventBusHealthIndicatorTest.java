package com.jarvis.core.health;

import com.jarvis.core.events.EventBus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventBusHealthIndicatorTest {

    @Test
    @DisplayName("Connected transport -> UP with transport name")
    void connectedIsUp() {
        var eventBus = mock(EventBus.class);
        when(eventBus.isConnected()).thenReturn(true);
        when(eventBus.transportName()).thenReturn("redis-streams");

        Health health = new EventBusHealthIndicator(eventBus).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("redis-streams", health.getDetails().get("transport"));
    }

    @Test
    @DisplayName("Disconnected transport -> DOWN")
    void disconnectedIsDown() {
        var eventBus = mock(EventBus.class);
        when(eventBus.isConnected()).thenReturn(false);
        when(eventBus.transportName()).thenReturn("memory");

        Health health = new EventBusHealthIndicator(eventBus).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("memory", health.getDetails().get("transport"));
    }
}
