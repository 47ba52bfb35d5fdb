package com.jarvis.core.approval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jarvis.core.TestClock;
import com.jarvis.core.model.ApprovalDecision;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcApprovalQueueTest extends ApprovalQueueContract {

    private JdbcDataSource dataSource;

    @Override
    protected ApprovalQueue createQueue(TestClock clock) throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:approvals_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        var jdbcQueue = new JdbcApprovalQueue(dataSource, new ObjectMapper(), clock);
        jdbcQueue.createTables();
        return jdbcQueue;
    }

    @Test
    @DisplayName("creating the tables twice is harmless")
    void createTablesIdempotent() throws Exception {
        ((JdbcApprovalQueue) queue).createTables();

        assertTrue(queue.listPending().isEmpty());
    }

    @Test
    @DisplayName("records survive a new queue instance over the same database")
    void durable() {
        String id = queue.create(pending("task_1", NOW, null));

        var reopened = new JdbcApprovalQueue(dataSource, new ObjectMapper(), clock);
        reopened.decide(id, ApprovalDecision.APPROVED, "alice", null, null);

        assertEquals(ApprovalDecision.APPROVED, queue.get(id).orElseThrow().decision());
    }

    @Test
    @DisplayName("a duplicate id surfaces as an approval error")
    void duplicateId() {
        var record = pending("task_1", NOW, null).withId("apr_fixed", NOW);
        queue.create(record);

        assertThrows(ApprovalException.class, () -> queue.create(record));
    }

    @Test
    @DisplayName("a corrupt JSON column surfaces as an approval error")
    void corruptJson() throws Exception {
        String id = queue.create(pending("task_1", NOW, null));
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("UPDATE approvals SET metadata = '{not json' WHERE id = '" + id + "'");
        }

        assertThrows(ApprovalException.class, () -> queue.get(id));
    }
}
