package com.polymarket.ctf.infra;

import com.polymarket.ctf.config.LedgerProperties;
import com.polymarket.ctf.core.ConditionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic summary log, every {@code ledger.audit.heartbeat-ms}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerHeartbeat implements SchedulingConfigurer {

    private final ConditionRegistry registry;
    private final LedgerAuditLog auditLog;
    private final LedgerProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = Duration.ofMillis(properties.audit().heartbeatMs());
        registrar.addFixedDelayTask(this::report, interval);
        log.debug("Ledger heartbeat every {}", interval);
    }

    public void report() {
        log.info("Ledger heartbeat: {} condition(s), events {}", registry.conditionCount(), auditLog.countsByType());
    }
}
