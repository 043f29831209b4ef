package com.jdc.pantry_service.domain.dto.inventory;

import com.jdc.pantry_service.domain.type.StorageLocation;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 부분 수정 요청. null 인 필드는 변경하지 않는다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryItemUpdateRequestDto {

    private StorageLocation storageLocation;

    @PositiveOrZero(message = "수량은 0 이상이어야 합니다.")
    @Digits(integer = 7, fraction = 3, message = "수량은 정수 7자리, 소수 3자리까지 입력할 수 있습니다.")
    private BigDecimal quantity;

    @Size(min = 1, max = 50)
    private String unit;

    private LocalDateTime expiryDate;

    @PositiveOrZero
    @Digits(integer = 7, fraction = 2)
    private BigDecimal cost;

    @Size(max = 1000)
    private String notes;
}
