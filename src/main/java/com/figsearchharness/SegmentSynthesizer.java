package com.figsearchharness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Builds line-query fixtures by laying disjoint random runs along every row
 * (horizontal) or column (vertical) and remembering the longest run while
 * doing so.  That run is the expected answer for the {@code hline} /
 * {@code vline} query on the produced bitmap.
 *
 * <p>Runs are drawn as half-open ranges {@code [begin, end)}; the next run
 * starts at {@code end + 1} or later, so two runs in one lane are always
 * separated by at least one unset cell.
 */
public final class SegmentSynthesizer {

    /** Half-open run {@code [begin, end)} along one lane. */
    public static final class Segment {
        public final int begin;
        public final int end;

        Segment(int begin, int end) {
            this.begin = begin;
            this.end = end;
        }

        public boolean isEmpty() { return end == begin; }
        public int cellCount()   { return end - begin; }

        @Override public String toString() { return "[" + begin + "," + end + ")"; }
    }

    /** Runs drawn for one lane and the longest of them. */
    public static final class LaneResult {
        public final int lane;
        public final int maxLength;
        public final List<Segment> segments;
        private final Line longest;

        LaneResult(int lane, int maxLength, List<Segment> segments, Line longest) {
            this.lane = lane;
            this.maxLength = maxLength;
            this.segments = Collections.unmodifiableList(segments);
            this.longest = longest;
        }

        /** True when no run in this lane covers a cell. */
        public boolean isEmpty() { return longest == null; }

        /** Longest run as a line; a zero-length line at the lane origin when the lane is empty. */
        public Line longest(Line.Axis axis) {
            if (longest != null) return longest;
            return axis == Line.Axis.HORIZONTAL ? Line.horizontal(lane, 0, 0) : Line.vertical(lane, 0, 0);
        }
    }

    /** A synthesized bitmap together with its answer. */
    public static final class Result {
        public final Bitmap bitmap;
        public final List<LaneResult> lanes;
        private final Line longest;

        Result(Bitmap bitmap, List<LaneResult> lanes, Line longest) {
            this.bitmap = bitmap;
            this.lanes = Collections.unmodifiableList(lanes);
            this.longest = longest;
        }

        /** Longest run in the bitmap, or {@code null} when no cell is set. */
        public Line longest() { return longest; }

        /** What the program under test must print for this bitmap. */
        public String expectedOutput() {
            return longest == null ? ReferenceSearch.NOT_FOUND : longest.format();
        }
    }

    private final Random rnd;
    private final Line.Axis axis;

    public SegmentSynthesizer(Random rnd, Line.Axis axis) {
        this.rnd = Objects.requireNonNull(rnd, "rnd");
        this.axis = Objects.requireNonNull(axis, "axis");
    }

    /** Upper bound for the per-lane maximum run length. Vertical lanes use a third of the extent. */
    int maxLengthBound(int extent) {
        return axis == Line.Axis.HORIZONTAL ? extent : extent / 3;
    }

    /**
     * Draws the runs of a single lane.  An extent of zero yields an empty lane
     * without drawing anything.
     */
    public LaneResult synthesizeLane(int lane, int extent) {
        if (extent <= 0) return new LaneResult(lane, 0, new ArrayList<>(), null);

        int maxLength = uniform(0, maxLengthBound(extent));
        List<Segment> segments = new ArrayList<>();
        Line best = null;
        int cursor = 0;
        while (cursor + maxLength <= extent) {
            int begin = uniform(cursor, cursor + maxLength);
            int end = uniform(begin, Math.min(begin + maxLength, extent));
            Segment s = new Segment(begin, end);
            segments.add(s);
            cursor = end + 1;

            if (s.isEmpty()) continue;
            Line line = toLine(lane, s);
            if (best == null || line.length() > best.length()) best = line;
        }
        return new LaneResult(lane, maxLength, segments, best);
    }

    /** Fills every lane of a bitmap of {@code size} and returns it with the longest run. */
    public Result synthesize(BitmapSize size) {
        int lanes = axis == Line.Axis.HORIZONTAL ? size.height() : size.width();
        int extent = axis == Line.Axis.HORIZONTAL ? size.width() : size.height();

        List<LaneResult> results = new ArrayList<>(lanes);
        Line longest = null;
        for (int lane = 0; lane < lanes; lane++) {
            LaneResult lr = synthesizeLane(lane, extent);
            results.add(lr);
            if (lr.isEmpty()) continue;
            Line local = lr.longest(axis);
            // ties keep the first maximum seen
            if (longest == null || local.length() > longest.length()) longest = local;
        }

        Bitmap bmp = new Bitmap(size);
        for (LaneResult lr : results) {
            for (Segment s : lr.segments) {
                if (!s.isEmpty()) bmp.fill(toLine(lr.lane, s));
            }
        }
        return new Result(bmp, results, longest);
    }

    private Line toLine(int lane, Segment s) {
        return axis == Line.Axis.HORIZONTAL
                ? Line.horizontal(lane, s.begin, s.end - 1)
                : Line.vertical(lane, s.begin, s.end - 1);
    }

    /** Uniform integer in the closed range {@code [lo, hi]}. */
    private int uniform(int lo, int hi) {
        return lo + rnd.nextInt(hi - lo + 1);
    }
}
