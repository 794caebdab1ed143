package com.figsearchharness;

import java.util.Comparator;
import java.util.Objects;

/** Axis-aligned solid square given by its inclusive top-left and bottom-right corners. */
public final class Square {

    /**
     * Orders squares so that the "largest" one compares greatest: a longer side wins,
     * then the smaller top row, then the smaller left column.
     */
    public static final Comparator<Square> BY_SIZE_THEN_POSITION =
            Comparator.comparingInt(Square::side)
                    .thenComparing(Comparator.comparingInt((Square s) -> s.topLeft().row()).reversed())
                    .thenComparing(Comparator.comparingInt((Square s) -> s.topLeft().col()).reversed());

    private final Point topLeft;
    private final Point bottomRight;

    public Square(Point topLeft, Point bottomRight) {
        this.topLeft = Objects.requireNonNull(topLeft, "topLeft");
        this.bottomRight = Objects.requireNonNull(bottomRight, "bottomRight");
        int dr = bottomRight.row() - topLeft.row();
        int dc = bottomRight.col() - topLeft.col();
        if (dr < 0 || dr != dc) {
            throw new IllegalArgumentException("Not a square: " + topLeft + " " + bottomRight);
        }
    }

    public static Square at(int row, int col, int side) {
        if (side < 1) throw new IllegalArgumentException("Square side must be >= 1, got " + side);
        return new Square(Point.of(row, col), Point.of(row + side - 1, col + side - 1));
    }

    public Point topLeft()     { return topLeft; }
    public Point bottomRight() { return bottomRight; }

    public int side() { return bottomRight.row() - topLeft.row() + 1; }

    public boolean isInside(BitmapSize size) {
        return topLeft.isInside(size) && bottomRight.isInside(size);
    }

    /** Wire form "R1 C1 R2 C2". */
    public String format() {
        return topLeft.row() + " " + topLeft.col() + " " + bottomRight.row() + " " + bottomRight.col();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Square)) return false;
        Square s = (Square) o;
        return topLeft.equals(s.topLeft) && bottomRight.equals(s.bottomRight);
    }

    @Override public int hashCode() { return Objects.hash(topLeft, bottomRight); }

    @Override public String toString() { return "Square[" + format() + "]"; }
}
