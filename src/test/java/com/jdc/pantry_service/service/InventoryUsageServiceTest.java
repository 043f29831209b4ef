package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.inventory.UsageLogDto;
import com.jdc.pantry_service.domain.dto.inventory.UsageRequestDto;
import com.jdc.pantry_service.domain.dto.inventory.UsageResultDto;
import com.jdc.pantry_service.domain.entity.Ingredient;
import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.entity.InventoryUsageLog;
import com.jdc.pantry_service.domain.repository.IngredientRepository;
import com.jdc.pantry_service.domain.repository.InventoryItemRepository;
import com.jdc.pantry_service.domain.repository.InventoryUsageLogRepository;
import com.jdc.pantry_service.domain.repository.RecipeRepository;
import com.jdc.pantry_service.domain.type.InventoryStatus;
import com.jdc.pantry_service.domain.type.StorageLocation;
import com.jdc.pantry_service.domain.type.UsageAction;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryUsageServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-10T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private InventoryItemRepository itemRepository;
    @Mock
    private InventoryUsageLogRepository usageLogRepository;
    @Mock
    private IngredientRepository ingredientRepository;
    @Mock
    private RecipeRepository recipeRepository;

    private InventoryUsageService service;

    private Ingredient onion;

    @BeforeEach
    void setUp() {
        service = new InventoryUsageService(itemRepository, usageLogRepository, ingredientRepository, recipeRepository, CLOCK);
        onion = Ingredient.builder().id(7L).name("양파").build();
    }

    private InventoryItem itemWithQuantity(String quantity, InventoryStatus status) {
        return InventoryItem.builder()
                .id(1L)
                .userId(1L)
                .ingredient(onion)
                .storageLocation(StorageLocation.PANTRY)
                .status(status)
                .quantity(new BigDecimal(quantity))
                .unit("개")
                .acquisitionDate(NOW.minusDays(2))
                .build();
    }

    @Test
    @DisplayName("markAsUsed: 5개 중 2개 사용 → 남은 수량 3, 상태는 그대로")
    void markAsUsed_partial_keepsStatus() {
        InventoryItem item = itemWithQuantity("5", InventoryStatus.USE_SOON);
        when(itemRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(item));

        UsageResultDto result = service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(new BigDecimal("2"))
                .action(UsageAction.SNACKED)
                .build());

        assertThat(result.remainingQuantity()).isEqualByComparingTo("3");
        assertThat(result.status()).isEqualTo(InventoryStatus.USE_SOON);
        assertThat(item.getQuantity()).isEqualByComparingTo("3");
        verify(itemRepository).save(item);
    }

    @Test
    @DisplayName("markAsUsed: 3개 중 3개 사용 → 수량 0, 상태 USED")
    void markAsUsed_exact_becomesUsed() {
        InventoryItem item = itemWithQuantity("3", InventoryStatus.FRESH);
        when(itemRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(item));

        UsageResultDto result = service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(new BigDecimal("3"))
                .build());

        assertThat(result.remainingQuantity()).isEqualByComparingTo("0");
        assertThat(result.status()).isEqualTo(InventoryStatus.USED);
        assertThat(item.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("markAsUsed: 요청 수량 그대로 사용 기록이 1건 저장된다")
    void markAsUsed_writesOneLogEntry() {
        InventoryItem item = itemWithQuantity("5", InventoryStatus.FRESH);
        when(itemRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(item));
        when(recipeRepository.existsById(30L)).thenReturn(true);

        service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(new BigDecimal("1.5"))
                .action(UsageAction.COOKED)
                .recipeId(30L)
                .notes("카레")
                .build());

        ArgumentCaptor<InventoryUsageLog> captor = ArgumentCaptor.forClass(InventoryUsageLog.class);
        verify(usageLogRepository, times(1)).save(captor.capture());
        InventoryUsageLog log = captor.getValue();

        assertThat(log.getInventoryItemId()).isEqualTo(1L);
        assertThat(log.getRecipeId()).isEqualTo(30L);
        assertThat(log.getAction()).isEqualTo(UsageAction.COOKED);
        assertThat(log.getQuantityUsed()).isEqualByComparingTo("1.5");
        assertThat(log.getUnit()).isEqualTo("개");
        assertThat(log.getNotes()).isEqualTo("카레");
        assertThat(log.getUsedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("markAsUsed: 레시피로 요리하면 재료 사용 횟수와 레시피 요리 횟수가 함께 증가한다")
    void markAsUsed_cookedWithRecipe_updatesCounters() {
        InventoryItem item = itemWithQuantity("5", InventoryStatus.FRESH);
        when(itemRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(item));
        when(recipeRepository.existsById(30L)).thenReturn(true);

        service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(BigDecimal.ONE)
                .action(UsageAction.COOKED)
                .recipeId(30L)
                .build());

        verify(ingredientRepository).incrementUsageCount(7L);
        verify(recipeRepository).incrementCookCount(30L);
    }

    @Test
    @DisplayName("markAsUsed: 요리가 아닌 사용은 레시피 요리 횟수를 올리지 않는다")
    void markAsUsed_notCooked_skipsRecipeCounter() {
        InventoryItem item = itemWithQuantity("5", InventoryStatus.FRESH);
        when(itemRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(item));
        when(recipeRepository.existsById(30L)).thenReturn(true);

        service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(BigDecimal.ONE)
                .action(UsageAction.DONATED)
                .recipeId(30L)
                .build());

        verify(ingredientRepository).incrementUsageCount(7L);
        verify(recipeRepository, never()).incrementCookCount(anyLong());
    }

    @Test
    @DisplayName("markAsUsed: 보유 수량보다 많이 사용하면 거절하고 아무것도 기록하지 않는다")
    void markAsUsed_overUse_rejected() {
        InventoryItem item = itemWithQuantity("2", InventoryStatus.FRESH);
        when(itemRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(item));

        assertThatThrownBy(() -> service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(new BigDecimal("3"))
                .build()))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INSUFFICIENT_INVENTORY_QUANTITY);

        assertThat(item.getQuantity()).isEqualByComparingTo("2");
        verifyNoInteractions(usageLogRepository, ingredientRepository);
    }

    @Test
    @DisplayName("markAsUsed: 이미 USED 인 아이템은 ITEM_ALREADY_TERMINAL")
    void markAsUsed_alreadyUsed_rejected() {
        InventoryItem item = itemWithQuantity("0", InventoryStatus.USED);
        when(itemRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(item));

        assertThatThrownBy(() -> service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(BigDecimal.ONE)
                .build()))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ITEM_ALREADY_TERMINAL);
        verify(usageLogRepository, never()).save(any());
    }

    @Test
    @DisplayName("markAsUsed: 존재하지 않는 아이템이면 INVENTORY_ITEM_NOT_FOUND")
    void markAsUsed_unknownItem() {
        when(itemRepository.findByIdForUpdate(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.markAsUsed(404L, UsageRequestDto.builder()
                .quantity(BigDecimal.ONE)
                .build()))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVENTORY_ITEM_NOT_FOUND);
    }

    @ParameterizedTest(name = "사용 수량 {0}")
    @ValueSource(strings = {"0.0001", "12345678901"})
    @DisplayName("markAsUsed: 컬럼 정밀도를 넘는 수량은 조회 전에 INVALID_INGREDIENT_QUANTITY")
    void markAsUsed_quantityOutOfPrecision(String quantity) {
        assertThatThrownBy(() -> service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(new BigDecimal(quantity))
                .build()))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_INGREDIENT_QUANTITY);

        verifyNoInteractions(itemRepository, usageLogRepository, ingredientRepository, recipeRepository);
    }

    @Test
    @DisplayName("markAsUsed: 0 이하 수량은 조회 전에 거절된다")
    void markAsUsed_nonPositiveQuantity() {
        assertThatThrownBy(() -> service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(BigDecimal.ZERO)
                .build()))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_INGREDIENT_QUANTITY);
        verifyNoInteractions(itemRepository);
    }

    @Test
    @DisplayName("markAsUsed: 존재하지 않는 레시피를 지정하면 RECIPE_NOT_FOUND")
    void markAsUsed_unknownRecipe() {
        InventoryItem item = itemWithQuantity("5", InventoryStatus.FRESH);
        when(itemRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(item));
        when(recipeRepository.existsById(999L)).thenReturn(false);

        assertThatThrownBy(() -> service.markAsUsed(1L, UsageRequestDto.builder()
                .quantity(BigDecimal.ONE)
                .recipeId(999L)
                .build()))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.RECIPE_NOT_FOUND);
        verify(usageLogRepository, never()).save(any());
    }

    @Test
    @DisplayName("getUsageHistory: 기록을 DTO 로 변환해 반환한다")
    void getUsageHistory_mapsLogs() {
        InventoryUsageLog log = InventoryUsageLog.builder()
                .id(100L)
                .inventoryItemId(1L)
                .action(UsageAction.COOKED)
                .quantityUsed(BigDecimal.ONE)
                .unit("개")
                .usedAt(NOW)
                .build();
        when(itemRepository.existsById(1L)).thenReturn(true);
        when(usageLogRepository.findAllByInventoryItemIdOrderByUsedAtDescIdDesc(1L)).thenReturn(List.of(log));

        List<UsageLogDto> history = service.getUsageHistory(1L);

        assertThat(history).hasSize(1);
        assertThat(history.get(0).getId()).isEqualTo(100L);
        assertThat(history.get(0).getAction()).isEqualTo(UsageAction.COOKED);
    }
}
