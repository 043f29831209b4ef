package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.inventory.UsageRequestDto;
import com.jdc.pantry_service.domain.dto.inventory.UsageResultDto;
import com.jdc.pantry_service.domain.entity.Ingredient;
import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.repository.IngredientRepository;
import com.jdc.pantry_service.domain.repository.InventoryItemRepository;
import com.jdc.pantry_service.domain.repository.InventoryUsageLogRepository;
import com.jdc.pantry_service.domain.repository.RecipeRepository;
import com.jdc.pantry_service.domain.type.InventoryStatus;
import com.jdc.pantry_service.domain.type.StorageLocation;
import com.jdc.pantry_service.domain.type.UsageAction;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * 실제 DB(H2)와 트랜잭션으로 재고 사용 처리의 잠금/롤백을 확인한다.
 */
@SpringBootTest
@ActiveProfiles("test")
class InventoryConcurrencyIntegrationTest {

    @Autowired
    private InventoryUsageService usageService;

    @Autowired
    private InventoryItemService itemService;

    @Autowired
    private InventoryItemRepository itemRepository;

    @Autowired
    private InventoryUsageLogRepository usageLogRepository;

    @Autowired
    private IngredientRepository ingredientRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private Clock clock;

    // 조리 횟수 갱신 실패를 흉내 내기 위해 레시피 저장소만 대체한다.
    @MockBean
    private RecipeRepository recipeRepository;

    private Ingredient onion;

    @BeforeEach
    void setUp() {
        onion = ingredientRepository.save(Ingredient.builder()
                .name("양파-" + System.nanoTime())
                .category("채소")
                .build());
    }

    @AfterEach
    void tearDown() {
        usageLogRepository.deleteAll();
        itemRepository.deleteAll();
        ingredientRepository.deleteAll();
    }

    private Long saveItem(String quantity, LocalDateTime expiry) {
        return itemRepository.save(InventoryItem.builder()
                .userId(1L)
                .ingredient(onion)
                .storageLocation(StorageLocation.FRIDGE)
                .status(InventoryStatus.FRESH)
                .quantity(new BigDecimal(quantity))
                .unit("개")
                .acquisitionDate(LocalDateTime.now(clock).minusDays(1))
                .expiryDate(expiry)
                .build()).getId();
    }

    private static UsageRequestDto use(String quantity) {
        return UsageRequestDto.builder()
                .quantity(new BigDecimal(quantity))
                .action(UsageAction.SNACKED)
                .build();
    }

    @Test
    @DisplayName("잠금 없이 읽은 조회 트랜잭션이 그 사이 커밋된 사용 처리를 덮어쓰지 못한다")
    void staleRead_cannotOverwriteCommittedUsage() {
        Long id = saveItem("3", LocalDateTime.now(clock).plusHours(12));

        assertThatThrownBy(() -> transactionTemplate.executeWithoutResult(tx -> {
            // 저장값 FRESH 를 먼저 읽어 둔다.
            InventoryItem stale = itemRepository.findById(id).orElseThrow();
            assertThat(stale.getStatus()).isEqualTo(InventoryStatus.FRESH);

            UsageResultDto used = CompletableFuture.supplyAsync(() -> usageService.markAsUsed(id, use("3"))).join();
            assertThat(used.status()).isEqualTo(InventoryStatus.USED);

            // 같은 트랜잭션 안에서 재분류되어 EXPIRING 으로 바뀐 뒤 커밋 시점에 충돌한다.
            itemService.get(id);
        })).isInstanceOf(OptimisticLockingFailureException.class);

        InventoryItem reloaded = itemRepository.findById(id).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(InventoryStatus.USED);
        assertThat(reloaded.getQuantity()).isEqualByComparingTo("0");
        assertThat(usageLogRepository.findAllByInventoryItemIdOrderByUsedAtDescIdDesc(id)).hasSize(1);
    }

    @Test
    @DisplayName("같은 아이템에 동시에 2개씩 두 번 사용하면 한 번만 반영된다 (3 → 1)")
    void concurrentUsage_isNotDoubleCounted() throws Exception {
        Long id = saveItem("3", null);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            List<CompletableFuture<Object>> tasks = List.of(
                    CompletableFuture.supplyAsync(() -> useAfter(start, id), executor),
                    CompletableFuture.supplyAsync(() -> useAfter(start, id), executor));
            start.countDown();
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

            List<Object> results = tasks.stream().map(CompletableFuture::join).toList();
            assertThat(results).filteredOn(UsageResultDto.class::isInstance).hasSize(1);
            assertThat(results).filteredOn(r -> !(r instanceof UsageResultDto))
                    .singleElement()
                    .satisfies(failure -> {
                        if (failure instanceof CustomException ce) {
                            assertThat(ce.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_INVENTORY_QUANTITY);
                        } else {
                            assertThat(failure).isInstanceOf(OptimisticLockingFailureException.class);
                        }
                    });
        } finally {
            executor.shutdown();
        }

        InventoryItem reloaded = itemRepository.findById(id).orElseThrow();
        assertThat(reloaded.getQuantity()).isEqualByComparingTo("1");
        assertThat(reloaded.getStatus()).isEqualTo(InventoryStatus.FRESH);
        assertThat(usageLogRepository.findAllByInventoryItemIdOrderByUsedAtDescIdDesc(id)).hasSize(1);
        assertThat(ingredientRepository.findById(onion.getId()).orElseThrow().getUsageCount()).isEqualTo(1L);
    }

    @Test
    @DisplayName("마지막 단계(조리 횟수 갱신)가 실패하면 기록, 차감, 사용 횟수가 모두 롤백된다")
    void failingStep_rollsBackEverything() {
        Long id = saveItem("3", null);
        when(recipeRepository.existsById(anyLong())).thenReturn(true);
        doThrow(new IllegalStateException("cook count update failed"))
                .when(recipeRepository).incrementCookCount(anyLong());

        assertThatThrownBy(() -> usageService.markAsUsed(id, UsageRequestDto.builder()
                .quantity(new BigDecimal("3"))
                .action(UsageAction.COOKED)
                .recipeId(77L)
                .build()))
                .isInstanceOf(IllegalStateException.class);

        InventoryItem reloaded = itemRepository.findById(id).orElseThrow();
        assertThat(reloaded.getQuantity()).isEqualByComparingTo("3");
        assertThat(reloaded.getStatus()).isEqualTo(InventoryStatus.FRESH);
        assertThat(usageLogRepository.findAllByInventoryItemIdOrderByUsedAtDescIdDesc(id)).isEmpty();
        assertThat(ingredientRepository.findById(onion.getId()).orElseThrow().getUsageCount()).isZero();
    }

    private Object useAfter(CountDownLatch start, Long id) {
        try {
            start.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        try {
            return usageService.markAsUsed(id, use("2"));
        } catch (RuntimeException e) {
            return e;
        }
    }
}
