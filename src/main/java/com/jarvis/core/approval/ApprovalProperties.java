package com.jarvis.core.approval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "jarvis.approvals")
public class ApprovalProperties {

    /** memory or jdbc. */
    private String store = "memory";
    private Duration defaultExpiration = Duration.ofHours(24);
    private ExpiryPolicy expiryPolicy = ExpiryPolicy.LEAVE_PENDING;

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public Duration getDefaultExpiration() { return defaultExpiration; }
    public void setDefaultExpiration(Duration defaultExpiration) { this.defaultExpiration = defaultExpiration; }
    public ExpiryPolicy getExpiryPolicy() { return expiryPolicy; }
    public void setExpiryPolicy(ExpiryPolicy expiryPolicy) { this.expiryPolicy = expiryPolicy; }
}
