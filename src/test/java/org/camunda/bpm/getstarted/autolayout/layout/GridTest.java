package org.camunda.bpm.getstarted.autolayout.layout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GridTest {

    @Test
    void shouldInsertIntoFreeCellWithoutShifting() {
        Grid grid = new Grid();
        grid.insert(1, 1, "a", 1);
        grid.insert(1, 2, "b", 1);

        assertEquals(1, grid.cellOf("a").row());
        assertEquals(1, grid.cellOf("b").row());
        assertTrue(grid.isOccupied(1, 2));
        assertFalse(grid.isOccupied(2, 2));
    }

    @Test
    void shouldShiftRowsAtOrBelowTakenCell() {
        Grid grid = new Grid();
        grid.insert(0, 1, "above", 2);
        grid.insert(1, 1, "taken", 2);
        grid.insert(3, 4, "below", 2);

        grid.insert(1, 1, "new", 2);

        assertEquals(0, grid.cellOf("above").row());
        assertEquals(3, grid.cellOf("taken").row());
        assertEquals(5, grid.cellOf("below").row());
        assertEquals(1, grid.cellOf("new").row());
        assertEquals(1, grid.cellOf("new").column());
    }

    @Test
    void shouldRejectPlacingNodeTwice() {
        Grid grid = new Grid();
        grid.insert(1, 1, "a", 1);

        assertThrows(IllegalStateException.class, () -> grid.insert(2, 1, "a", 1));
    }
}
