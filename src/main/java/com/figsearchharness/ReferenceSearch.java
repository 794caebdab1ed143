package com.figsearchharness;

/**
 * Straightforward scans answering the three queries directly from a bitmap.
 * Used to cross-check synthesized answers; ties go to the smaller row, then
 * the smaller column, which is how the program under test reports them.
 */
public final class ReferenceSearch {
    public static final String NOT_FOUND = "Not found";

    private ReferenceSearch(){}

    /** Longest horizontal run, or {@code null} when no cell is set. */
    public static Line longestHorizontal(Bitmap bmp) {
        Line best = null;
        for (int r = 0; r < bmp.height(); r++) {
            int c = 0;
            while (c < bmp.width()) {
                if (!bmp.get(r, c)) { c++; continue; }
                int start = c;
                while (c + 1 < bmp.width() && bmp.get(r, c + 1)) c++;
                Line l = Line.horizontal(r, start, c);
                if (isBetter(l, best)) best = l;
                c++;
            }
        }
        return best;
    }

    /** Longest vertical run, or {@code null} when no cell is set. */
    public static Line longestVertical(Bitmap bmp) {
        Line best = null;
        for (int c = 0; c < bmp.width(); c++) {
            int r = 0;
            while (r < bmp.height()) {
                if (!bmp.get(r, c)) { r++; continue; }
                int start = r;
                while (r + 1 < bmp.height() && bmp.get(r + 1, c)) r++;
                Line l = Line.vertical(c, start, r);
                if (isBetter(l, best)) best = l;
                r++;
            }
        }
        return best;
    }

    /** Largest solid square, or {@code null} when no cell is set. */
    public static Square largestSquare(Bitmap bmp) {
        int h = bmp.height(), w = bmp.width();
        // side of the largest square whose bottom-right corner is (r, c)
        int[][] dp = new int[h][w];
        int maxSide = 0;
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                if (!bmp.get(r, c)) continue;
                dp[r][c] = (r == 0 || c == 0) ? 1
                        : 1 + Math.min(dp[r - 1][c - 1], Math.min(dp[r - 1][c], dp[r][c - 1]));
                maxSide = Math.max(maxSide, dp[r][c]);
            }
        }
        if (maxSide == 0) return null;

        Square best = null;
        for (int r = maxSide - 1; r < h; r++) {
            for (int c = maxSide - 1; c < w; c++) {
                if (dp[r][c] < maxSide) continue;
                Square sq = Square.at(r - maxSide + 1, c - maxSide + 1, maxSide);
                if (best == null || Square.BY_SIZE_THEN_POSITION.compare(sq, best) > 0) best = sq;
            }
        }
        return best;
    }

    public static String format(Line line) { return line == null ? NOT_FOUND : line.format(); }

    public static String format(Square sq) { return sq == null ? NOT_FOUND : sq.format(); }

    private static boolean isBetter(Line candidate, Line best) {
        if (best == null) return true;
        if (candidate.length() != best.length()) return candidate.length() > best.length();
        if (candidate.begin().row() != best.begin().row()) return candidate.begin().row() < best.begin().row();
        return candidate.begin().col() < best.begin().col();
    }
}
