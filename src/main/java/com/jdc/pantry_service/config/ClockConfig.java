package com.jdc.pantry_service.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 유통기한 판정, 보관 일수 계산 등 "현재 시각"이 필요한 모든 곳은 이 Clock을 주입받는다.
 */
@Configuration
@RequiredArgsConstructor
public class ClockConfig {

    private final InventoryProperties inventoryProperties;

    @Bean
    public Clock clock() {
        return Clock.system(inventoryProperties.zoneId());
    }
}
