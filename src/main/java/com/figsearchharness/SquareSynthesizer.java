package com.figsearchharness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Builds square-query fixtures by stamping between one and ten random solid
 * squares onto an empty bitmap.  The expected answer is the largest stamped
 * square under {@link Square#BY_SIZE_THEN_POSITION}.
 *
 * <p>Stamps may overlap.  The answer is taken from the stamps themselves and
 * does not consider larger squares formed by overlapping stamps.
 */
public final class SquareSynthesizer {
    public static final int MAX_SQUARES = 10;

    /** A synthesized bitmap together with its answer. */
    public static final class Result {
        public final Bitmap bitmap;
        public final List<Square> squares;
        public final Square largest;

        Result(Bitmap bitmap, List<Square> squares, Square largest) {
            this.bitmap = bitmap;
            this.squares = Collections.unmodifiableList(squares);
            this.largest = largest;
        }

        public String expectedOutput() { return largest.format(); }
    }

    private final Random rnd;

    public SquareSynthesizer(Random rnd) {
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    /** Largest side a stamp may have; a quarter of the shorter dimension, at least 1. */
    static int sideBound(BitmapSize size) {
        return Math.max(1, Math.min(size.width(), size.height()) / 4);
    }

    public Result synthesize(BitmapSize size) {
        int count = 1 + rnd.nextInt(MAX_SQUARES);
        int bound = sideBound(size);

        Bitmap bmp = new Bitmap(size);
        List<Square> squares = new ArrayList<>(count);
        Square largest = null;
        for (int i = 0; i < count; i++) {
            int side = 1 + rnd.nextInt(bound);
            int row = rnd.nextInt(size.height() - side + 1);
            int col = rnd.nextInt(size.width() - side + 1);
            Square sq = Square.at(row, col, side);

            bmp.fill(sq);
            squares.add(sq);
            if (largest == null || Square.BY_SIZE_THEN_POSITION.compare(sq, largest) > 0) largest = sq;
        }
        return new Result(bmp, squares, largest);
    }
}
