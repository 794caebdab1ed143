package com.figsearchharness;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A dense grid of bits.  Rows and columns are indexed from zero and the
 * dimensions never change after construction; every cell starts unset.
 */
public class Bitmap {
    public static final char FILLED = '1';
    public static final char EMPTY  = '0';

    private final BitmapSize size;
    private final boolean[][] cells;

    public Bitmap(BitmapSize size) {
        this.size = size;
        this.cells = new boolean[size.height()][size.width()];
    }

    public BitmapSize size() { return size; }
    public int width()       { return size.width(); }
    public int height()      { return size.height(); }

    /** Returns whether the cell at row {@code r}, column {@code c} is set. */
    public boolean get(int r, int c) {
        return cells[r][c];
    }

    /** Sets the cell at row {@code r}, column {@code c}. */
    public void set(int r, int c, boolean value) {
        cells[r][c] = value;
    }

    /** Sets every cell of {@code line}. */
    public void fill(Line line) {
        int r0 = Math.min(line.begin().row(), line.end().row());
        int r1 = Math.max(line.begin().row(), line.end().row());
        int c0 = Math.min(line.begin().col(), line.end().col());
        int c1 = Math.max(line.begin().col(), line.end().col());
        for (int r = r0; r <= r1; r++)
            for (int c = c0; c <= c1; c++)
                cells[r][c] = true;
    }

    /** Sets every cell covered by {@code sq}. */
    public void fill(Square sq) {
        for (int r = sq.topLeft().row(); r <= sq.bottomRight().row(); r++)
            for (int c = sq.topLeft().col(); c <= sq.bottomRight().col(); c++)
                cells[r][c] = true;
    }

    public long countSet() {
        long n = 0;
        for (boolean[] row : cells)
            for (boolean b : row)
                if (b) n++;
        return n;
    }

    /** Character written to fixture files for the cell. */
    public char symbolAt(int r, int c) {
        return cells[r][c] ? FILLED : EMPTY;
    }

    /** Writes this bitmap in the plain fixture format: single spaces and newlines. */
    public void write(Writer out) throws IOException {
        new BitmapWriter(Separators.PLAIN).write(out, this);
    }

    public static Bitmap readFromFile(Path file) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.US_ASCII)) {
            return read(br);
        }
    }

    /**
     * Parses a fixture: a header "height width" followed by exactly
     * {@code height * width} cells.  Any run of whitespace (space, tab, newline,
     * vertical tab, form feed, carriage return) separates tokens and cells may
     * also be adjacent.
     */
    public static Bitmap read(Reader in) throws IOException {
        long height = readDimension(in, "height");
        long width = readDimension(in, "width");
        if (height > Integer.MAX_VALUE || width > Integer.MAX_VALUE)
            throw new IOException("Dimensions too large: " + height + "x" + width);

        Bitmap bmp = new Bitmap(new BitmapSize((int) width, (int) height));
        long expected = bmp.size.cellCount();
        long seen = 0;
        int ch;
        while ((ch = in.read()) != -1) {
            if (Separators.isWhitespace((char) ch)) continue;
            if (ch != FILLED && ch != EMPTY)
                throw new IOException("Unexpected character encountered: '" + (char) ch + "'");
            if (seen >= expected)
                throw new IOException("More cells than the header allows (" + height + "x" + width + ")");
            bmp.cells[(int) (seen / width)][(int) (seen % width)] = ch == FILLED;
            seen++;
        }
        if (seen != expected)
            throw new IOException("Found " + seen + " cells but the header declares " + height + "x" + width + "=" + expected);
        return bmp;
    }

    private static long readDimension(Reader in, String name) throws IOException {
        int ch;
        do {
            ch = in.read();
        } while (ch != -1 && Separators.isWhitespace((char) ch));
        if (ch == -1) throw new IOException("Missing " + name + " in header");

        long value = 0;
        int digits = 0;
        while (ch != -1 && ch >= '0' && ch <= '9') {
            value = value * 10 + (ch - '0');
            if (value > Integer.MAX_VALUE) throw new IOException("Header " + name + " is out of range");
            digits++;
            ch = in.read();
        }
        if (digits == 0 || (ch != -1 && !Separators.isWhitespace((char) ch)))
            throw new IOException("Header " + name + " is not an unsigned integer");
        if (value == 0) throw new IOException("Header " + name + " cannot be zero");
        return value;
    }
}
