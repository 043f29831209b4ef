package com.jdc.pantry_service.scheduler;

import com.jdc.pantry_service.service.InventoryItemService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryStatusSchedulerTest {

    @Mock
    private InventoryItemService inventoryItemService;

    @InjectMocks
    private InventoryStatusScheduler scheduler;

    @Test
    @DisplayName("스케줄 실행 시 전체 재고 상태를 재분류한다")
    void reclassifyStatuses_delegates() {
        when(inventoryItemService.reclassifyAll()).thenReturn(3);

        scheduler.reclassifyStatuses();

        verify(inventoryItemService).reclassifyAll();
    }

    @Test
    @DisplayName("재분류 중 예외가 나도 스케줄러 밖으로 전파하지 않는다")
    void reclassifyStatuses_failureIsLogged() {
        when(inventoryItemService.reclassifyAll()).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> scheduler.reclassifyStatuses()).doesNotThrowAnyException();
    }
}
