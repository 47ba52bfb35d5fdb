package com.jarvis.core.approval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jarvis.core.events.EventBus;
import com.jarvis.core.metrics.JarvisMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Provides the {@link ApprovalQueue} selected by {@code jarvis.approvals.store}.
 */
@Configuration
public class ApprovalQueueConfig {

    private static final Logger log = LoggerFactory.getLogger(ApprovalQueueConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "jarvis.approvals", name = "store", havingValue = "jdbc")
    public ApprovalQueue jdbcApprovalQueue(ObjectProvider<DataSource> dataSource, ObjectMapper objectMapper,
                                           Clock clock) throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            throw new IllegalStateException("jarvis.approvals.store=jdbc requires a DataSource (spring.datasource.*)");
        }
        log.info("Configuring JDBC approval queue");
        var queue = new JdbcApprovalQueue(ds, objectMapper, clock);
        queue.createTables();
        return queue;
    }

    @Bean
    @ConditionalOnProperty(prefix = "jarvis.approvals", name = "store", havingValue = "memory", matchIfMissing = true)
    public ApprovalQueue inMemoryApprovalQueue(Clock clock) {
        log.info("Using in-memory approval queue (approvals will not persist across restarts)");
        return new InMemoryApprovalQueue(clock);
    }

    @Bean
    public ApprovalExpirySweeper approvalExpirySweeper(ApprovalQueue queue, EventBus eventBus,
                                                       ApprovalProperties props, JarvisMetrics metrics) {
        metrics.gaugePendingApprovals(() -> queue.stats().pending());
        return new ApprovalExpirySweeper(queue, eventBus, props.getExpiryPolicy(), metrics);
    }
}
