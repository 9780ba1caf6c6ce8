package com.polymarket.ctf.infra;

import com.polymarket.ctf.core.LedgerEventPublisher;
import com.polymarket.ctf.domain.event.LedgerEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SpringLedgerEventPublisher implements LedgerEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(LedgerEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
