package com.chicu.airetrain.monitor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DriftScorersTest {

    private final MeanShiftDriftScorer meanShift = new MeanShiftDriftScorer();
    private final KolmogorovSmirnovDriftScorer ks = new KolmogorovSmirnovDriftScorer();

    @Test
    void meanShift_identicalDistributions_isZero() {
        List<Double> xs = List.of(1.0, 2.0, 3.0, 4.0, 5.0);
        assertEquals(0.0, meanShift.score(xs, xs), 1e-12);
    }

    @Test
    void meanShift_shiftByOneStd() {
        // σb = 1 (выборочное), сдвиг на 1, σ одинаковые → (1 + 0) / 2
        List<Double> base = List.of(-1.0, 0.0, 1.0);
        List<Double> cur = List.of(0.0, 1.0, 2.0);
        assertEquals(0.5, meanShift.score(base, cur), 1e-12);
    }

    @Test
    void meanShift_isCappedAtOne() {
        assertEquals(1.0, meanShift.score(List.of(0.0, 1.0, 2.0), List.of(100.0, 101.0, 102.0)), 1e-12);
    }

    @Test
    void meanShift_constantBaseline_isZero() {
        assertEquals(0.0, meanShift.score(List.of(3.0, 3.0, 3.0), List.of(5.0, 6.0)), 1e-12);
    }

    @Test
    void ks_disjointSamples_isOne() {
        assertEquals(1.0, ks.score(List.of(1.0, 2.0, 3.0), List.of(10.0, 11.0)), 1e-12);
    }

    @Test
    void ks_identicalSamples_isZero() {
        List<Double> xs = List.of(1.0, 2.0, 2.0, 5.0);
        assertEquals(0.0, ks.score(xs, xs), 1e-12);
    }

    @Test
    void ks_halfOverlap() {
        assertEquals(0.5, ks.score(List.of(1.0, 2.0), List.of(2.0, 3.0)), 1e-12);
    }

    @Test
    void emptyInput_isZero() {
        assertEquals(0.0, ks.score(List.of(), List.of(1.0)));
        assertEquals(0.0, meanShift.score(List.of(1.0), List.of(1.0, 2.0)));
    }
}
