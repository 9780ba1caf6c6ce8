package com.polymarket.ctf.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.polymarket.ctf.config.LedgerProperties;
import com.polymarket.ctf.domain.event.LedgerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ordered record of every committed ledger event. Each event is also logged as one JSON line.
 */
@Slf4j
@Component
public class LedgerAuditLog {

    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final List<LedgerEvent> events = new ArrayList<>();

    public LedgerAuditLog(ObjectMapper objectMapper, LedgerProperties properties) {
        // slot and position ids do not fit in a JSON number
        this.objectMapper = objectMapper.copy()
                .registerModule(new SimpleModule().addSerializer(BigInteger.class, ToStringSerializer.instance));
        this.enabled = properties.audit().enabled();
    }

    @EventListener
    public synchronized void onEvent(LedgerEvent event) {
        if (!enabled) {
            return;
        }
        events.add(event);
        log.info("[AUDIT] {}", toJson(event));
    }

    public synchronized List<LedgerEvent> getEvents() {
        return List.copyOf(events);
    }

    public synchronized <T extends LedgerEvent> List<T> getEvents(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    public synchronized Map<String, Long> countsByType() {
        Map<String, Long> counts = new TreeMap<>();
        for (LedgerEvent event : events) {
            counts.merge(event.getClass().getSimpleName(), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * {"type": "PositionSplit", ...fields}; big integers are written as decimal strings.
     */
    public String toJson(LedgerEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.getClass().getSimpleName());
        node.setAll((ObjectNode) objectMapper.valueToTree(event));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render audit event " + event, e);
        }
    }
}
