package com.figsearchharness;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Serializes bitmaps into the fixture text format:
 * <pre>
 *   &lt;height&gt;SEP&lt;width&gt;LINE_END
 *   &lt;width cells joined by SEP&gt;LINE_END      (height times)
 * </pre>
 * The header values and the cell symbols can be overridden so that
 * malformed fixtures go through the same code path as valid ones.
 */
public final class BitmapWriter {

    /** Supplies the symbol written for one cell. */
    public interface CellRenderer {
        char render(int row, int col);
    }

    private final Separators separators;

    public BitmapWriter(Separators separators) {
        this.separators = Objects.requireNonNull(separators, "separators");
    }

    /** Writes {@code bmp} with a truthful header and its own cell symbols. */
    public void write(Writer out, Bitmap bmp) throws IOException {
        write(out, bmp.height(), bmp.width(), bmp.size(), bmp::symbolAt);
    }

    /**
     * Writes a header declaring {@code headerHeight x headerWidth} followed by a
     * body laid out as {@code body}, each cell produced by {@code cells}.
     */
    public void write(Writer out, int headerHeight, int headerWidth, BitmapSize body, CellRenderer cells) throws IOException {
        out.write(Integer.toString(headerHeight));
        out.write(separators.separator());
        out.write(Integer.toString(headerWidth));
        out.write(separators.lineEnd());

        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < body.height(); r++) {
            sb.setLength(0);
            for (int c = 0; c < body.width(); c++) {
                if (c > 0) sb.append(separators.separator());
                sb.append(cells.render(r, c));
            }
            sb.append(separators.lineEnd());
            out.write(sb.toString());
        }
        out.flush();
    }
}
