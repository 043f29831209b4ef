package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.inventory.InventoryItemRequestDto;
import com.jdc.pantry_service.domain.dto.inventory.InventoryItemResponseDto;
import com.jdc.pantry_service.domain.dto.inventory.InventoryItemUpdateRequestDto;
import com.jdc.pantry_service.domain.dto.inventory.InventorySearchCondition;
import com.jdc.pantry_service.domain.entity.Ingredient;
import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.repository.IngredientRepository;
import com.jdc.pantry_service.domain.repository.InventoryItemRepository;
import com.jdc.pantry_service.domain.type.InventoryStatus;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.mapper.InventoryItemMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 재고 아이템 CRUD.
 * 조회/저장 시점마다 상태를 다시 계산하므로, 읽기 메서드도 변경된 상태를 저장하기 위해 쓰기 트랜잭션을 사용한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class InventoryItemService {

    static final Comparator<InventoryItem> LIST_ORDER =
            Comparator.comparing(InventoryItem::getExpiryDate, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
                    .thenComparing(InventoryItem::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
                    .thenComparing(InventoryItem::getId, Comparator.nullsLast(Comparator.<Long>reverseOrder()));

    static final int MAX_PAGE_SIZE = 100;

    /** 목록 정렬에 쓸 수 있는 필드. API 의 snake_case 이름도 받는다. */
    private static final Map<String, Function<InventoryItem, LocalDateTime>> SORT_KEYS = Map.of(
            "createdAt", InventoryItem::getCreatedAt,
            "created_at", InventoryItem::getCreatedAt,
            "updatedAt", InventoryItem::getUpdatedAt,
            "updated_at", InventoryItem::getUpdatedAt,
            "expiryDate", InventoryItem::getExpiryDate,
            "expiry_date", InventoryItem::getExpiryDate
    );

    private final InventoryItemRepository repo;
    private final IngredientRepository ingRepo;
    private final InventoryStatusClassifier classifier;
    private final Clock clock;

    /** 재고 아이템 추가 (취득일 = 현재, 초기 상태는 유통기한으로 판정) */
    public InventoryItemResponseDto create(Long userId, InventoryItemRequestDto dto) {
        InventoryAmounts.requireQuantity(dto.getQuantity());
        if (dto.getStorageLocation() == null) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "storageLocation is required");
        }
        if (dto.getUnit() == null || dto.getUnit().isBlank()) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "unit is required");
        }
        InventoryAmounts.checkCost(dto.getCost());
        if (dto.getIngredientId() == null) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "ingredientId is required");
        }

        Ingredient ing = ingRepo.findById(dto.getIngredientId())
                .orElseThrow(() -> new CustomException(ErrorCode.INGREDIENT_NOT_FOUND));

        LocalDateTime now = LocalDateTime.now(clock);

        InventoryItem saved = repo.save(
                InventoryItem.builder()
                        .userId(userId)
                        .ingredient(ing)
                        .storageLocation(dto.getStorageLocation())
                        .status(classifier.classify(dto.getExpiryDate(), now))
                        .quantity(dto.getQuantity())
                        .unit(dto.getUnit().trim())
                        .acquisitionDate(now)
                        .expiryDate(dto.getExpiryDate())
                        .cost(dto.getCost())
                        .notes(dto.getNotes())
                        .build()
        );

        return InventoryItemMapper.toDto(saved);
    }

    /** 단건 조회 */
    public InventoryItemResponseDto get(Long itemId) {
        InventoryItem item = findItem(itemId);
        classifier.refresh(item, LocalDateTime.now(clock));
        return InventoryItemMapper.toDto(item);
    }

    /**
     * 내 재고 목록 (페이징).
     * 정렬을 지정하지 않으면 유통기한 오름차순(없는 항목은 뒤), 같은 경우 최근 등록순.
     * status 필터는 다시 계산된 상태 기준으로 적용되므로 필터와 페이징은 메모리에서 처리한다.
     */
    public Page<InventoryItemResponseDto> list(Long userId, InventorySearchCondition cond, Pageable pageable) {
        InventorySearchCondition condition = cond != null ? cond : InventorySearchCondition.empty();
        Integer withinDays = condition.getExpiringWithinDays();
        if (withinDays != null && withinDays < 0) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "expiringWithinDays must be >= 0");
        }
        if (pageable.isPaged() && pageable.getPageSize() > MAX_PAGE_SIZE) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "page size must be <= " + MAX_PAGE_SIZE);
        }
        Comparator<InventoryItem> order = toComparator(pageable.getSort());

        LocalDateTime now = LocalDateTime.now(clock);
        List<InventoryItem> items = repo.findAllByUserId(userId);
        items.forEach(item -> classifier.refresh(item, now));

        List<InventoryItem> matched = items.stream()
                .filter(item -> condition.getStorageLocation() == null
                        || item.getStorageLocation() == condition.getStorageLocation())
                .filter(item -> condition.getStatus() == null || item.getStatus() == condition.getStatus())
                .filter(item -> withinDays == null || expiresWithin(item, now, withinDays))
                .sorted(order)
                .toList();

        if (pageable.isUnpaged()) {
            return new PageImpl<>(matched.stream().map(InventoryItemMapper::toDto).toList());
        }
        int from = (int) Math.min(pageable.getOffset(), matched.size());
        int to = Math.min(from + pageable.getPageSize(), matched.size());
        List<InventoryItemResponseDto> content = matched.subList(from, to).stream()
                .map(InventoryItemMapper::toDto)
                .toList();
        return new PageImpl<>(content, pageable, matched.size());
    }

    /** 부분 수정. 종료 상태 아이템은 수정할 수 없다. */
    public InventoryItemResponseDto update(Long itemId, InventoryItemUpdateRequestDto dto) {
        InventoryItem item = findItem(itemId);
        if (item.isTerminal()) {
            throw new CustomException(ErrorCode.ITEM_ALREADY_TERMINAL);
        }

        if (dto.getStorageLocation() != null) {
            item.updateStorageLocation(dto.getStorageLocation());
        }
        if (dto.getQuantity() != null) {
            InventoryAmounts.requireQuantity(dto.getQuantity());
            item.updateQuantity(dto.getQuantity());
        }
        if (dto.getUnit() != null) {
            if (dto.getUnit().isBlank()) {
                throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "unit must not be blank");
            }
            item.updateUnit(dto.getUnit().trim());
        }
        if (dto.getExpiryDate() != null) {
            item.updateExpiryDate(dto.getExpiryDate());
        }
        if (dto.getCost() != null) {
            InventoryAmounts.checkCost(dto.getCost());
            item.updateCost(dto.getCost());
        }
        if (dto.getNotes() != null) {
            item.updateNotes(dto.getNotes());
        }

        classifier.refresh(item, LocalDateTime.now(clock));
        return InventoryItemMapper.toDto(item);
    }

    /** 영구 삭제. 상태와 무관하며 사용/폐기 기록은 남는다. */
    public boolean delete(Long itemId) {
        if (!repo.existsById(itemId)) {
            return false;
        }
        repo.deleteById(itemId);
        log.info("[Inventory] item {} deleted", itemId);
        return true;
    }

    /** 요청자가 아이템 소유자인지 확인 */
    @Transactional(readOnly = true)
    public void verifyOwner(Long userId, Long itemId) {
        InventoryItem item = findItem(itemId);
        if (!item.getUserId().equals(userId)) {
            throw new CustomException(ErrorCode.INVENTORY_ACCESS_DENIED);
        }
    }

    /**
     * 레시피 매칭용 보유 재고. 상태를 다시 계산한 뒤 FRESH / USE_SOON / EXPIRING 만 남긴다.
     */
    public List<InventoryItem> findAvailableItems(Long userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<InventoryItem> items = repo.findAllByUserIdAndStatusNotIn(userId, InventoryStatus.TERMINAL);
        items.forEach(item -> classifier.refresh(item, now));
        return items.stream()
                .filter(InventoryItem::isAvailable)
                .toList();
    }

    /** 종료 상태가 아닌 모든 아이템의 상태를 다시 계산한다. 변경된 건수를 반환. */
    public int reclassifyAll() {
        LocalDateTime now = LocalDateTime.now(clock);
        int changed = 0;
        for (InventoryItem item : repo.findAllByStatusNotIn(InventoryStatus.TERMINAL)) {
            if (classifier.refresh(item, now)) {
                changed++;
            }
        }
        return changed;
    }

    private InventoryItem findItem(Long itemId) {
        return repo.findById(itemId)
                .orElseThrow(() -> new CustomException(ErrorCode.INVENTORY_ITEM_NOT_FOUND));
    }

    private boolean expiresWithin(InventoryItem item, LocalDateTime now, int days) {
        LocalDateTime expiry = item.getExpiryDate();
        return expiry != null
                && !expiry.isBefore(now)
                && !expiry.isAfter(now.plusDays(days));
    }

    /** 지정된 정렬 뒤에 id 내림차순을 붙여 순서를 고정한다. null 값은 방향과 무관하게 뒤로 보낸다. */
    private Comparator<InventoryItem> toComparator(Sort sort) {
        if (sort.isUnsorted()) {
            return LIST_ORDER;
        }
        Comparator<InventoryItem> order = null;
        for (Sort.Order o : sort) {
            Function<InventoryItem, LocalDateTime> key = SORT_KEYS.get(o.getProperty());
            if (key == null) {
                throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "Unsupported sort property: " + o.getProperty());
            }
            Comparator<InventoryItem> next = Comparator.comparing(key, o.isAscending()
                    ? Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder())
                    : Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));
            order = order == null ? next : order.thenComparing(next);
        }
        return order.thenComparing(InventoryItem::getId, Comparator.nullsLast(Comparator.<Long>reverseOrder()));
    }
}
