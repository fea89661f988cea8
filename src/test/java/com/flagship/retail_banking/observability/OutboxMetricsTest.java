package com.flagship.retail_banking.observability;

import com.flagship.retail_banking.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxMetricsTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private OutboxEventRepository outboxRepository;

    private SimpleMeterRegistry meterRegistry;
    private OutboxMetrics outboxMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        outboxMetrics = new OutboxMetrics(outboxRepository, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(outboxMetrics, "maxRetries", 5);
        outboxMetrics.init();
    }

    @Test
    void refresh_UpdatesGauges() {
        when(outboxRepository.countUnpublished()).thenReturn(12L);
        when(outboxRepository.findOldestUnpublishedCreatedAt()).thenReturn(Optional.of(NOW.minusSeconds(90)));
        when(outboxRepository.countDeadLettered(5)).thenReturn(2L);

        outboxMetrics.refreshMetrics();

        assertEquals(12L, outboxMetrics.getBacklogSize());
        assertEquals(12.0, meterRegistry.get("outbox.backlog.size").gauge().value());
        assertEquals(90.0, meterRegistry.get("outbox.backlog.age.seconds").gauge().value());
        assertEquals(2.0, meterRegistry.get("outbox.events.dead_lettered").gauge().value());
    }

    @Test
    void refresh_EmptyOutbox() {
        when(outboxRepository.countUnpublished()).thenReturn(0L);
        when(outboxRepository.findOldestUnpublishedCreatedAt()).thenReturn(Optional.empty());
        when(outboxRepository.countDeadLettered(5)).thenReturn(0L);

        outboxMetrics.refreshMetrics();

        assertEquals(0L, outboxMetrics.getBacklogSize());
        assertEquals(0.0, meterRegistry.get("outbox.backlog.age.seconds").gauge().value());
    }

    @Test
    void refresh_KeepsLastValuesWhenDatabaseFails() {
        when(outboxRepository.countUnpublished()).thenReturn(3L)
            .thenThrow(new DataAccessResourceFailureException("database down"));
        when(outboxRepository.findOldestUnpublishedCreatedAt()).thenReturn(Optional.empty());
        when(outboxRepository.countDeadLettered(5)).thenReturn(0L);

        outboxMetrics.refreshMetrics();
        assertDoesNotThrow(() -> outboxMetrics.refreshMetrics());

        assertEquals(3L, outboxMetrics.getBacklogSize());
    }
}
