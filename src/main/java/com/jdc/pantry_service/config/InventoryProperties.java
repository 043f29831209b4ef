package com.jdc.pantry_service.config;

import lombok.Getter; import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
@ConfigurationProperties(prefix = "app.inventory")
@Getter @Setter
public class InventoryProperties {
    private int defaultMinMatchPercentage = 50;
    private int defaultMatchLimit = 20;
    private int maxMatchLimit = 50;
    private String reclassifyCron = "0 0 * * * *";
    private String timezone = "Asia/Seoul";
    public ZoneId zoneId() { return ZoneId.of(timezone); }
}
