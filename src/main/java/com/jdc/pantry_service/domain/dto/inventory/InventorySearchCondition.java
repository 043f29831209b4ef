package com.jdc.pantry_service.domain.dto.inventory;

import com.jdc.pantry_service.domain.type.InventoryStatus;
import com.jdc.pantry_service.domain.type.StorageLocation;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventorySearchCondition {
    private StorageLocation storageLocation;
    private InventoryStatus status;

    @Schema(description = "N일 이내 유통기한 도래 (유통기한 없는 아이템 제외)", example = "3")
    private Integer expiringWithinDays;

    public static InventorySearchCondition empty() {
        return new InventorySearchCondition();
    }
}
