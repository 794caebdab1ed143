package com.figsearchharness;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class GeometryTest {

    @Test
    public void singleCellLineHasLengthZero() {
        assertEquals(0, Line.horizontal(3, 4, 4).length());
        assertEquals(0, Line.vertical(2, 7, 7).length());
    }

    @Test
    public void lineLengthIsCoordinateDifference() {
        assertEquals(5, Line.horizontal(0, 2, 7).length());
        assertEquals(3, Line.vertical(1, 4, 7).length());
    }

    @Test
    public void lineFormatsRowMajor() {
        assertEquals("1 2 1 4", Line.horizontal(1, 2, 4).format());
        assertEquals("3 5 8 5", Line.vertical(5, 3, 8).format());
    }

    @Test
    public void lineRejectsSkewedEndpoints() {
        assertThrows(IllegalArgumentException.class,
                () -> new Line(Point.of(0, 0), Point.of(1, 2), Line.Axis.HORIZONTAL));
        assertThrows(IllegalArgumentException.class,
                () -> new Line(Point.of(0, 0), Point.of(1, 2), Line.Axis.VERTICAL));
    }

    @Test
    public void squareSideCountsCells() {
        Square s = Square.at(2, 3, 4);
        assertEquals(4, s.side());
        assertEquals(Point.of(5, 6), s.bottomRight());
        assertEquals("2 3 5 6", s.format());
        assertEquals(1, Square.at(0, 0, 1).side());
    }

    @Test
    public void squareRejectsRectangles() {
        assertThrows(IllegalArgumentException.class, () -> new Square(Point.of(0, 0), Point.of(1, 2)));
        assertThrows(IllegalArgumentException.class, () -> Square.at(0, 0, 0));
    }

    @Test
    public void squareOrderingPrefersSideThenTopThenLeft() {
        Square big = Square.at(5, 5, 3);
        Square smallHigh = Square.at(0, 0, 2);
        assertTrue(Square.BY_SIZE_THEN_POSITION.compare(big, smallHigh) > 0);

        Square upper = Square.at(1, 9, 2);
        Square lower = Square.at(2, 0, 2);
        assertTrue(Square.BY_SIZE_THEN_POSITION.compare(upper, lower) > 0, "smaller row wins a tie");

        Square left = Square.at(1, 3, 2);
        Square right = Square.at(1, 4, 2);
        assertTrue(Square.BY_SIZE_THEN_POSITION.compare(left, right) > 0, "smaller column wins a tie");
        assertEquals(0, Square.BY_SIZE_THEN_POSITION.compare(left, Square.at(1, 3, 2)));
    }

    @Test
    public void squareContainment() {
        BitmapSize size = new BitmapSize(4, 3);
        assertTrue(Square.at(0, 1, 3).isInside(size));
        assertFalse(Square.at(1, 1, 3).isInside(size));
    }

    @Test
    public void bitmapSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new BitmapSize(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new BitmapSize(5, -1));
        assertEquals(20L, new BitmapSize(4, 5).cellCount());
    }
}
