package com.figsearchharness;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class OutputComparatorTest {

    @Test
    public void exactMatchPasses() {
        assertEquals(Verdict.PASS, OutputComparator.classify("Invalid", "Invalid"));
        assertEquals(Verdict.PASS, OutputComparator.classify("1 2 1 4", "1 2 1 4\n"));
    }

    @Test
    public void surroundingWhitespaceIsIgnored() {
        assertEquals(Verdict.PASS, OutputComparator.classify(" Valid\n", "\r\n\tValid  \n"));
    }

    @Test
    public void containedExpectedNeedsReview() {
        assertEquals(Verdict.NEEDS_REVIEW, OutputComparator.classify("Invalid", "Error: Invalid bitmap, Invalid dims"));
        assertEquals(Verdict.NEEDS_REVIEW, OutputComparator.classify("0 0 3 3", "result: 0 0 3 3"));
    }

    @Test
    public void anythingElseFails() {
        assertEquals(Verdict.FAIL, OutputComparator.classify("Valid", "Invalid"));
        assertEquals(Verdict.FAIL, OutputComparator.classify("1 2 1 4", "2 1 4 1"));
        assertEquals(Verdict.FAIL, OutputComparator.classify("Invalid", ""));
        assertEquals(Verdict.FAIL, OutputComparator.classify("Not found", "not found"));
    }
}
