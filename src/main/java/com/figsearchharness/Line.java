package com.figsearchharness;

import java.util.Objects;

/**
 * A horizontal or vertical run of set cells given by its two inclusive end points.
 * The length is the coordinate difference along the varying axis, so a
 * single-cell line has length 0.
 */
public final class Line {
    public enum Axis { HORIZONTAL, VERTICAL }

    private final Point begin;
    private final Point end;
    private final Axis axis;

    public Line(Point begin, Point end, Axis axis) {
        this.begin = Objects.requireNonNull(begin, "begin");
        this.end = Objects.requireNonNull(end, "end");
        this.axis = Objects.requireNonNull(axis, "axis");
        if (axis == Axis.HORIZONTAL && begin.row() != end.row())
            throw new IllegalArgumentException("Horizontal line must stay on one row: " + begin + " " + end);
        if (axis == Axis.VERTICAL && begin.col() != end.col())
            throw new IllegalArgumentException("Vertical line must stay in one column: " + begin + " " + end);
    }

    /** Horizontal line on {@code row} spanning columns {@code from..to}. */
    public static Line horizontal(int row, int from, int to) {
        return new Line(Point.of(row, from), Point.of(row, to), Axis.HORIZONTAL);
    }

    /** Vertical line in {@code col} spanning rows {@code from..to}. */
    public static Line vertical(int col, int from, int to) {
        return new Line(Point.of(from, col), Point.of(to, col), Axis.VERTICAL);
    }

    public Point begin() { return begin; }
    public Point end()   { return end; }
    public Axis axis()   { return axis; }

    public int length() {
        return axis == Axis.HORIZONTAL
                ? Math.abs(end.col() - begin.col())
                : Math.abs(end.row() - begin.row());
    }

    /** Wire form "R1 C1 R2 C2". */
    public String format() {
        return begin.row() + " " + begin.col() + " " + end.row() + " " + end.col();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Line)) return false;
        Line l = (Line) o;
        return axis == l.axis && begin.equals(l.begin) && end.equals(l.end);
    }

    @Override public int hashCode() { return Objects.hash(begin, end, axis); }

    @Override public String toString() { return axis + "[" + format() + "]"; }
}
