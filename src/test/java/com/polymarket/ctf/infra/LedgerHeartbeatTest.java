package com.polymarket.ctf.infra;

import com.polymarket.ctf.config.LedgerProperties;
import com.polymarket.ctf.core.ConditionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.config.IntervalTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LedgerHeartbeatTest {

    private final ConditionRegistry registry = mock(ConditionRegistry.class);
    private final LedgerAuditLog auditLog = mock(LedgerAuditLog.class);

    @Test
    void schedulesAtConfiguredInterval() {
        LedgerProperties properties = new LedgerProperties(null, null, new LedgerProperties.Audit(true, 2_500L));
        LedgerHeartbeat heartbeat = new LedgerHeartbeat(registry, auditLog, properties);
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        heartbeat.configureTasks(registrar);

        List<IntervalTask> tasks = registrar.getFixedDelayTaskList();
        assertEquals(1, tasks.size());
        assertEquals(Duration.ofMillis(2_500), tasks.get(0).getIntervalDuration());
    }

    @Test
    void defaultIntervalIsOneMinute() {
        LedgerHeartbeat heartbeat = new LedgerHeartbeat(registry, auditLog, LedgerProperties.defaults());
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        heartbeat.configureTasks(registrar);

        assertEquals(Duration.ofMinutes(1), registrar.getFixedDelayTaskList().get(0).getIntervalDuration());
    }

    @Test
    void scheduledTaskReportsRegistryAndAuditCounts() {
        when(registry.conditionCount()).thenReturn(3);
        when(auditLog.countsByType()).thenReturn(Map.of("PositionSplit", 2L));
        LedgerHeartbeat heartbeat = new LedgerHeartbeat(registry, auditLog, LedgerProperties.defaults());
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();
        heartbeat.configureTasks(registrar);

        registrar.getFixedDelayTaskList().get(0).getRunnable().run();

        verify(registry).conditionCount();
        verify(auditLog).countsByType();
    }
}
