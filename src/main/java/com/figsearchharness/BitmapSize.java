package com.figsearchharness;

/** Dimensions of a bitmap; both sides are strictly positive. */
public final class BitmapSize {
    private final int width;
    private final int height;

    public BitmapSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Bitmap dimensions must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public int width()  { return width; }
    public int height() { return height; }

    /** Number of cells, widened so huge sizes do not overflow. */
    public long cellCount() { return (long) width * height; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BitmapSize)) return false;
        BitmapSize s = (BitmapSize) o;
        return width == s.width && height == s.height;
    }

    @Override public int hashCode() { return 31 * width + height; }

    @Override public String toString() { return "BitmapSize(width=" + width + ", height=" + height + ")"; }
}
