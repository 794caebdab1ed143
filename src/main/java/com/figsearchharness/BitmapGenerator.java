package com.figsearchharness;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Random;

/**
 * Produces random bitmap fixtures for the {@code test} query, either well formed
 * or with corrupted header dimensions and cell symbols.  All randomness is
 * drawn from the {@link Random} handed to the constructor, so a seeded source
 * reproduces byte-identical files.
 */
public final class BitmapGenerator {

    /** Symbols written in place of a bit when a cell is corrupted; none is whitespace, '0' or '1'. */
    public static final String INVALID_SYMBOLS = "23456789abcxyzABCXYZ#@*+-.!?";

    private final Random rnd;

    public BitmapGenerator(Random rnd) {
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    /** Every cell independently set with probability 0.5. */
    public Bitmap randomBitmap(BitmapSize size) {
        Bitmap bmp = new Bitmap(size);
        for (int r = 0; r < size.height(); r++)
            for (int c = 0; c < size.width(); c++)
                bmp.set(r, c, rnd.nextBoolean());
        return bmp;
    }

    /** Writes a random, well formed fixture and returns {@link Validity#VALID}. */
    public Validity writeValid(Path file, BitmapSize size, Separators separators) throws IOException {
        Bitmap bmp = randomBitmap(size);
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
            new BitmapWriter(separators).write(w, bmp);
        }
        return Validity.VALID;
    }

    /**
     * Writes a fixture of {@code size} where each header dimension is, with
     * probability 0.5, replaced by a value drawn uniformly from [0, original],
     * and each cell is, with probability 0.5, replaced by an invalid symbol.
     *
     * @return {@link Validity#INVALID} when at least one draw changed the file,
     *         {@link Validity#VALID} when every draw happened to leave it intact
     */
    public Validity writeCorrupted(Path file, BitmapSize size, Separators separators) throws IOException {
        int height = size.height();
        int width = size.width();
        int headerHeight = rnd.nextBoolean() ? rnd.nextInt(height + 1) : height;
        int headerWidth = rnd.nextBoolean() ? rnd.nextInt(width + 1) : width;
        boolean[] corrupted = { headerHeight != height || headerWidth != width };

        BitmapWriter.CellRenderer cells = (r, c) -> {
            if (rnd.nextBoolean()) {
                corrupted[0] = true;
                return INVALID_SYMBOLS.charAt(rnd.nextInt(INVALID_SYMBOLS.length()));
            }
            return rnd.nextBoolean() ? Bitmap.FILLED : Bitmap.EMPTY;
        };

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
            new BitmapWriter(separators).write(w, headerHeight, headerWidth, size, cells);
        }
        return corrupted[0] ? Validity.INVALID : Validity.VALID;
    }
}
