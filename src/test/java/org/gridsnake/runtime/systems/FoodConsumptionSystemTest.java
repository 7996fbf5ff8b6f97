package org.gridsnake.runtime.systems;

import org.gridsnake.runtime.model.ArenaProperties;
import org.gridsnake.runtime.model.GameState;
import org.gridsnake.runtime.model.GridPosition;
import org.gridsnake.runtime.model.SnakeStart;
import org.gridsnake.runtime.spi.IFoodSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class FoodConsumptionSystemTest {

    @Mock
    private IFoodSource food;

    private GameState state;
    private final FoodConsumptionSystem system = new FoodConsumptionSystem();

    @BeforeEach
    void setUp() {
        state = new GameState(new ArenaProperties(10, 10), SnakeStart.DEFAULT, Duration.ofMillis(150));
        SnakeSpawner.spawn(state);
    }

    @Test
    void foodElsewhere_isIgnored() {
        when(food.getFoodPositions()).thenReturn(List.of(new GridPosition(0, 0)));

        assertThat(system.detect(state, food)).isZero();

        verify(food, never()).removeFood(any());
        assertThat(state.getEvents().getPendingGrowth()).isZero();
    }

    @Test
    void foodOnHead_isRemovedAndQueuesGrowth() {
        GridPosition head = new GridPosition(3, 3);
        when(food.getFoodPositions()).thenReturn(List.of(new GridPosition(1, 1), head));
        when(food.removeFood(head)).thenReturn(true);

        assertThat(system.detect(state, food)).isEqualTo(1);

        verify(food).removeFood(head);
        assertThat(state.getEvents().getPendingGrowth()).isEqualTo(1);
        assertThat(state.getFoodEaten()).isEqualTo(1);
    }

    @Test
    @DisplayName("Two items on the head cell produce two growth events")
    void stackedFood_producesOneEventPerItem() {
        GridPosition head = new GridPosition(3, 3);
        when(food.getFoodPositions()).thenReturn(List.of(head, head));
        when(food.removeFood(head)).thenReturn(true);

        assertThat(system.detect(state, food)).isEqualTo(2);

        verify(food, times(2)).removeFood(head);
        assertThat(state.getEvents().getPendingGrowth()).isEqualTo(2);
    }

    @Test
    void failedRemoval_doesNotQueueGrowth() {
        GridPosition head = new GridPosition(3, 3);
        when(food.getFoodPositions()).thenReturn(List.of(head));
        when(food.removeFood(head)).thenReturn(false);

        assertThat(system.detect(state, food)).isZero();
        assertThat(state.getEvents().getPendingGrowth()).isZero();
    }
}
