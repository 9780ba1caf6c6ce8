package com.polymarket.ctf.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Objects;

@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
        String custodyAddress,
        List<String> sandboxCollateral,
        Audit audit
) {

    public static final String DEFAULT_CUSTODY_ADDRESS = "0x000000000000000000000000000000000000c7f0";

    public LedgerProperties {
        if (custodyAddress == null || custodyAddress.isBlank()) {
            custodyAddress = DEFAULT_CUSTODY_ADDRESS;
        }
        sandboxCollateral = sandboxCollateral == null
                ? List.of()
                : sandboxCollateral.stream()
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
        if (audit == null) {
            audit = new Audit(null, null);
        }
    }

    public static LedgerProperties defaults() {
        return new LedgerProperties(null, null, null);
    }

    public record Audit(Boolean enabled, Long heartbeatMs) {
        public Audit {
            if (enabled == null) {
                enabled = true;
            }
            if (heartbeatMs == null) {
                heartbeatMs = 60_000L;
            }
        }
    }
}
