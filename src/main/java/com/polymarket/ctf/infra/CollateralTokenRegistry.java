package com.polymarket.ctf.infra;

import com.polymarket.ctf.core.LedgerHashes;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class CollateralTokenRegistry {

    private final ConcurrentHashMap<String, CollateralToken> tokens = new ConcurrentHashMap<>();

    public void register(CollateralToken token) {
        String address = LedgerHashes.normalizeAddress(token.address());
        tokens.put(address, token);
        log.info("Registered collateral token {} ({})", address, token.getClass().getSimpleName());
    }

    public Optional<CollateralToken> find(String address) {
        return Optional.ofNullable(tokens.get(LedgerHashes.normalizeAddress(address)));
    }

    public Map<String, CollateralToken> getAll() {
        return Map.copyOf(tokens);
    }
}
