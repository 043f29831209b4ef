package com.jdc.pantry_service.domain.dto.inventory;

import com.jdc.pantry_service.domain.type.InventoryStatus;

import java.math.BigDecimal;

public record UsageResultDto(
        BigDecimal remainingQuantity,
        InventoryStatus status
) { }
