package com.jarvis.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "jarvis.bus")
public class EventBusProperties {

    /** memory, pubsub or stream. */
    private String transport = "memory";
    private String agentName = "jarvis";
    private String signingSecret = "";
    private boolean verifyInbound = true;
    private String streamKeyPrefix = "events:";
    private String consumerGroup = "jarvis";
    private String consumerId;
    private int batchSize = 10;
    private Duration blockTimeout = Duration.ofSeconds(5);
    private int dedupeCapacity = 10_000;
    private Backoff backoff = new Backoff();

    public String getTransport() { return transport; }
    public void setTransport(String transport) { this.transport = transport; }
    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }
    public String getSigningSecret() { return signingSecret; }
    public void setSigningSecret(String signingSecret) { this.signingSecret = signingSecret; }
    public boolean isVerifyInbound() { return verifyInbound; }
    public void setVerifyInbound(boolean verifyInbound) { this.verifyInbound = verifyInbound; }
    public String getStreamKeyPrefix() { return streamKeyPrefix; }
    public void setStreamKeyPrefix(String streamKeyPrefix) { this.streamKeyPrefix = streamKeyPrefix; }
    public String getConsumerGroup() { return consumerGroup; }
    public void setConsumerGroup(String consumerGroup) { this.consumerGroup = consumerGroup; }

    /** Falls back to the agent name, so each service instance reads as itself. */
    public String getConsumerId() {
        return consumerId == null || consumerId.isBlank() ? agentName : consumerId;
    }
    public void setConsumerId(String consumerId) { this.consumerId = consumerId; }
    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public Duration getBlockTimeout() { return blockTimeout; }
    public void setBlockTimeout(Duration blockTimeout) { this.blockTimeout = blockTimeout; }
    public int getDedupeCapacity() { return dedupeCapacity; }
    public void setDedupeCapacity(int dedupeCapacity) { this.dedupeCapacity = dedupeCapacity; }
    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public static class Backoff {
        private Duration base = Duration.ofSeconds(1);
        private Duration max = Duration.ofSeconds(30);

        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
    }
}
