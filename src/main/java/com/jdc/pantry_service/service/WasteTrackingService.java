package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.waste.WasteRequestDto;
import com.jdc.pantry_service.domain.dto.waste.WasteResultDto;
import com.jdc.pantry_service.domain.dto.waste.WasteSummaryDto;
import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.entity.WasteRecord;
import com.jdc.pantry_service.domain.repository.InventoryItemRepository;
import com.jdc.pantry_service.domain.repository.WasteRecordRepository;
import com.jdc.pantry_service.domain.type.WasteOutcome;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class WasteTrackingService {

    private final InventoryItemRepository itemRepository;
    private final WasteRecordRepository wasteRecordRepository;
    private final InventoryStatusClassifier classifier;
    private final Clock clock;

    /**
     * 폐기 처리. 보관 일수를 계산해 기록하고 아이템을 WASTED 로 종료한다. 수량은 그대로 둔다.
     * 비용은 요청 값 → 아이템 구매 비용 → null 순으로 사용한다.
     */
    @Transactional
    public WasteResultDto markAsWasted(Long itemId, WasteRequestDto dto) {
        if (dto.getOutcome() == null) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "outcome is required");
        }
        InventoryAmounts.checkCost(dto.getCost());
        InventoryAmounts.checkWeight(dto.getWeight());

        InventoryItem item = itemRepository.findByIdForUpdate(itemId)
                .orElseThrow(() -> new CustomException(ErrorCode.INVENTORY_ITEM_NOT_FOUND));

        if (item.isTerminal()) {
            throw new CustomException(ErrorCode.ITEM_ALREADY_TERMINAL);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        int daysOwned = (int) Math.max(0, classifier.floorDays(item.getAcquisitionDate(), now));
        BigDecimal cost = dto.getCost() != null ? dto.getCost() : item.getCost();

        wasteRecordRepository.save(
                WasteRecord.builder()
                        .userId(item.getUserId())
                        .ingredientId(item.getIngredient().getId())
                        .inventoryItemId(item.getId())
                        .outcome(dto.getOutcome())
                        .cost(cost)
                        .weight(dto.getWeight())
                        .daysOwned(daysOwned)
                        .notes(dto.getNotes())
                        .wastedAt(now)
                        .build()
        );

        item.markWasted();
        itemRepository.save(item);

        log.info("[Inventory] item {} wasted ({}), owned {} days", itemId, dto.getOutcome().getCode(), daysOwned);
        return new WasteResultDto(daysOwned);
    }

    /** 폐기 통계. since 가 null 이면 전체 기간. */
    @Transactional(readOnly = true)
    public WasteSummaryDto getWasteSummary(Long userId, LocalDateTime since) {
        List<WasteRecord> records = since == null
                ? wasteRecordRepository.findAllByUserIdOrderByWastedAtDesc(userId)
                : wasteRecordRepository.findAllByUserIdAndWastedAtGreaterThanEqualOrderByWastedAtDesc(userId, since);

        Map<WasteOutcome, Long> countByOutcome = new EnumMap<>(WasteOutcome.class);
        for (WasteRecord r : records) {
            countByOutcome.merge(r.getOutcome(), 1L, Long::sum);
        }

        BigDecimal totalCost = records.stream()
                .map(WasteRecord::getCost)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal totalWeight = records.stream()
                .map(WasteRecord::getWeight)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        double averageDaysOwned = records.stream()
                .mapToInt(WasteRecord::getDaysOwned)
                .average()
                .orElse(0.0);

        return WasteSummaryDto.builder()
                .recordCount(records.size())
                .totalCost(totalCost)
                .totalWeight(totalWeight)
                .averageDaysOwned(averageDaysOwned)
                .countByOutcome(countByOutcome)
                .build();
    }
}
