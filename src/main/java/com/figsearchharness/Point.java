package com.figsearchharness;

/** Immutable cell coordinate inside a bitmap; rows and columns are indexed from zero. */
public final class Point {
    private final int row;
    private final int col;

    public Point(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public static Point of(int row, int col) { return new Point(row, col); }

    public int row() { return row; }
    public int col() { return col; }

    /** True when this point addresses a cell of a bitmap with the given size. */
    public boolean isInside(BitmapSize size) {
        return row >= 0 && col >= 0 && row < size.height() && col < size.width();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point p = (Point) o;
        return row == p.row && col == p.col;
    }

    @Override public int hashCode() { return 31 * row + col; }

    @Override public String toString() { return "(" + row + "," + col + ")"; }
}
