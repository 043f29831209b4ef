package com.jdc.pantry_service.scheduler;

import com.jdc.pantry_service.service.InventoryItemService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;


@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryStatusScheduler {

    private final InventoryItemService inventoryItemService;

    @Scheduled(cron = "${app.inventory.reclassify-cron:0 0 * * * *}")
    public void reclassifyStatuses() {
        log.info(">>>> [Inventory Scheduler] Status reclassification started.");

        try {
            int updatedCount = inventoryItemService.reclassifyAll();
            log.info(">>>> [Inventory Scheduler] Finished. (Updated: {} items)", updatedCount);
        } catch (Exception e) {
            log.error(">>>> [Inventory Scheduler] Failed to reclassify inventory statuses.", e);
        }
    }
}
