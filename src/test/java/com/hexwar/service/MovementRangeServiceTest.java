package com.hexwar.service;

import com.hexwar.model.ArmyBranch;
import com.hexwar.model.HexCoordinate;
import com.hexwar.model.MapBounds;
import com.hexwar.model.MapUnit;
import com.hexwar.model.PlayerSide;
import com.hexwar.movement.MovementQuery;
import com.hexwar.movement.MovementRange;
import com.hexwar.movement.MovementRangeSolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MovementRangeService.
 */
@ExtendWith(MockitoExtension.class)
class MovementRangeServiceTest {

    @Mock
    private MovementRangeSolver solver;

    @InjectMocks
    private MovementRangeService movementRangeService;

    private static MovementQuery.MovementQueryBuilder query() {
        return MovementQuery.builder()
                .start(HexCoordinate.of(2, 2))
                .movementAllowance(2)
                .hexes(List.of())
                .bounds(new MapBounds(5, 5))
                .units(List.of())
                .side(PlayerSide.PLAYER_ONE)
                .branch(ArmyBranch.INFANTRY);
    }

    /** A real range on an empty 5x5 map, from (2,2) with allowance 2. */
    private static MovementRange openRange() {
        return new MovementRangeSolver().solve(query().build());
    }

    @Nested
    @DisplayName("calculateRange")
    class CalculateRangeTests {

        @Test
        void delegatesValidQueryToSolver() {
            MovementQuery valid = query().build();
            MovementRange expected = openRange();
            when(solver.solve(valid)).thenReturn(expected);

            MovementRange result = movementRangeService.calculateRange(valid);

            assertSame(expected, result);
            verify(solver).solve(valid);
        }

        @Test
        @DisplayName("builds the query from the unit's own position, allowance, side and branch")
        void buildsQueryFromUnit() {
            MapUnit unit = MapUnit.builder().id("p2-art-1").side(PlayerSide.PLAYER_TWO)
                    .column(1).row(3).movementAllowance(3).branch(ArmyBranch.ARTILLERY).build();
            when(solver.solve(any())).thenReturn(openRange());

            movementRangeService.calculateRange(unit, List.of(), new MapBounds(5, 5), List.of(unit));

            ArgumentCaptor<MovementQuery> captor = ArgumentCaptor.forClass(MovementQuery.class);
            verify(solver).solve(captor.capture());
            MovementQuery sent = captor.getValue();
            assertEquals(HexCoordinate.of(1, 3), sent.start());
            assertEquals(3, sent.movementAllowance());
            assertEquals(PlayerSide.PLAYER_TWO, sent.side());
            assertEquals(ArmyBranch.ARTILLERY, sent.branch());
            assertEquals(List.of(unit), List.copyOf(sent.units()));
        }

        @Test
        void rejectsNegativeAllowance() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.calculateRange(query().movementAllowance(-1).build()));

            assertEquals("Movement allowance cannot be negative: -1", ex.getMessage());
            verifyNoInteractions(solver);
        }

        @Test
        void rejectsStartOutsideMap() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.calculateRange(query().start(HexCoordinate.of(5, 0)).build()));

            assertEquals("Start hex (5, 0) is outside the 5x5 map", ex.getMessage());
            verifyNoInteractions(solver);
        }

        @Test
        void rejectsEmptyMap() {
            assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.calculateRange(query().bounds(new MapBounds(0, 4)).build()));
            assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.calculateRange(query().bounds(null).build()));
            verifyNoInteractions(solver);
        }

        @Test
        void rejectsMissingSideOrStart() {
            assertEquals("Side of the moving unit is required", assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.calculateRange(query().side(null).build())).getMessage());
            assertEquals("Start hex is required", assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.calculateRange(query().start(null).build())).getMessage());
            assertEquals("Movement query is required", assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.calculateRange(null)).getMessage());
            verifyNoInteractions(solver);
        }

        @Test
        void rejectsMissingUnit() {
            assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.calculateRange(null, List.of(), new MapBounds(5, 5), List.of()));
            verifyNoInteractions(solver);
        }
    }

    @Nested
    @DisplayName("requireReachable")
    class RequireReachableTests {

        @Test
        void returnsCostOfReachableHex() {
            assertEquals(2, movementRangeService.requireReachable(openRange(), HexCoordinate.of(2, 0)));
            assertEquals(1, movementRangeService.requireReachable(openRange(), HexCoordinate.of(3, 2)));
        }

        @Test
        void rejectsHexOutsideRange() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.requireReachable(openRange(), HexCoordinate.of(0, 4)));

            assertEquals("Destination hex (0, 4) is not within movement range. Movement allowance: 2",
                    ex.getMessage());
        }

        @Test
        void rejectsStayingInPlace() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> movementRangeService.requireReachable(openRange(), HexCoordinate.of(2, 2)));

            assertEquals("Unit is already at (2, 2)", ex.getMessage());
        }
    }
}
