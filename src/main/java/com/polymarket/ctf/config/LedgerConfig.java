package com.polymarket.ctf.config;

import com.polymarket.ctf.infra.CollateralTokenRegistry;
import com.polymarket.ctf.infra.InMemoryCollateralToken;
import com.polymarket.ctf.infra.ReceiverRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    @Bean
    public CollateralTokenRegistry collateralTokenRegistry(LedgerProperties properties) {
        CollateralTokenRegistry registry = new CollateralTokenRegistry();
        for (String address : properties.sandboxCollateral()) {
            registry.register(new InMemoryCollateralToken(address));
        }
        if (properties.sandboxCollateral().isEmpty()) {
            log.warn("No collateral tokens configured. Splits from raw collateral will fail until one is registered.");
        }
        return registry;
    }

    @Bean
    public ReceiverRegistry receiverRegistry() {
        return new ReceiverRegistry();
    }
}
