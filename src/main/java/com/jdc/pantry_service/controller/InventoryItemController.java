package com.jdc.pantry_service.controller;

import com.jdc.pantry_service.domain.dto.inventory.*;
import com.jdc.pantry_service.domain.dto.waste.WasteRequestDto;
import com.jdc.pantry_service.domain.dto.waste.WasteResultDto;
import com.jdc.pantry_service.domain.dto.waste.WasteSummaryDto;
import com.jdc.pantry_service.domain.type.InventoryStatus;
import com.jdc.pantry_service.domain.type.StorageLocation;
import com.jdc.pantry_service.service.InventoryItemService;
import com.jdc.pantry_service.service.InventoryUsageService;
import com.jdc.pantry_service.service.WasteTrackingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

@RestController
@RequestMapping("/api/v1/inventory")
@RequiredArgsConstructor
@Tag(name = "재고 API", description = "보유 재료를 등록/수정/삭제하고, 사용·폐기 처리를 기록합니다.")
public class InventoryItemController {

    static final String USER_HEADER = "X-User-Id";

    private final InventoryItemService inventoryItemService;
    private final InventoryUsageService inventoryUsageService;
    private final WasteTrackingService wasteTrackingService;

    @GetMapping
    @Operation(summary = "내 재고 조회", description = "보관 위치, 상태, 유통기한 임박 일수로 필터링합니다. "
            + "sort 를 지정하지 않으면 유통기한 오름차순으로 정렬됩니다. sort 는 createdAt, updatedAt, expiryDate 만 가능하고 size 는 최대 100 입니다.")
    public ResponseEntity<Page<InventoryItemResponseDto>> getMyItems(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @RequestParam(required = false) String storage,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer expiringWithinDays,
            @PageableDefault(size = 20) Pageable pageable) {

        InventorySearchCondition cond = InventorySearchCondition.builder()
                .storageLocation(storage == null || storage.isBlank() ? null : StorageLocation.fromCode(storage))
                .status(status == null || status.isBlank() ? null : InventoryStatus.fromCode(status))
                .expiringWithinDays(expiringWithinDays)
                .build();

        return ResponseEntity.ok(inventoryItemService.list(userId, cond, pageable));
    }

    @PostMapping
    @Operation(summary = "재고 추가", description = "재료를 내 재고에 추가합니다. 초기 상태는 유통기한으로 판정됩니다.")
    public ResponseEntity<InventoryItemResponseDto> addItem(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @RequestBody @Valid InventoryItemRequestDto dto) {
        var created = inventoryItemService.create(userId, dto);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    @Operation(summary = "재고 단건 조회")
    public ResponseEntity<InventoryItemResponseDto> getItem(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long id) {
        inventoryItemService.verifyOwner(userId, id);
        return ResponseEntity.ok(inventoryItemService.get(id));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "재고 수정", description = "전달된 필드만 수정합니다. 사용 완료/폐기된 아이템은 수정할 수 없습니다.")
    public ResponseEntity<InventoryItemResponseDto> updateItem(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long id,
            @RequestBody @Valid InventoryItemUpdateRequestDto dto) {
        inventoryItemService.verifyOwner(userId, id);
        return ResponseEntity.ok(inventoryItemService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "재고 삭제")
    public ResponseEntity<?> deleteItem(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long id) {
        inventoryItemService.verifyOwner(userId, id);
        inventoryItemService.delete(id);
        return ResponseEntity.ok(Collections.emptyMap());
    }

    @PostMapping("/{id}/use")
    @Operation(summary = "재고 사용", description = "사용량만큼 차감하고 기록합니다. 모두 사용하면 used 상태가 됩니다.")
    public ResponseEntity<UsageResultDto> useItem(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long id,
            @RequestBody @Valid UsageRequestDto dto) {
        inventoryItemService.verifyOwner(userId, id);
        return ResponseEntity.ok(inventoryUsageService.markAsUsed(id, dto));
    }

    @GetMapping("/{id}/usage")
    @Operation(summary = "재고 사용 기록 조회")
    public ResponseEntity<List<UsageLogDto>> getUsageHistory(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long id) {
        inventoryItemService.verifyOwner(userId, id);
        return ResponseEntity.ok(inventoryUsageService.getUsageHistory(id));
    }

    @PostMapping("/{id}/waste")
    @Operation(summary = "재고 폐기", description = "폐기 사유를 기록하고 wasted 상태로 종료합니다.")
    public ResponseEntity<WasteResultDto> wasteItem(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long id,
            @RequestBody @Valid WasteRequestDto dto) {
        inventoryItemService.verifyOwner(userId, id);
        return ResponseEntity.ok(wasteTrackingService.markAsWasted(id, dto));
    }

    @GetMapping("/waste/summary")
    @Operation(summary = "폐기 통계", description = "since 이후(없으면 전체) 폐기 건수, 비용, 무게, 평균 보관 일수를 집계합니다.")
    public ResponseEntity<WasteSummaryDto> getWasteSummary(
            @Parameter(hidden = true) @RequestHeader(USER_HEADER) Long userId,
            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime since) {
        return ResponseEntity.ok(wasteTrackingService.getWasteSummary(userId, since));
    }
}
