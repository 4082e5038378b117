package com.chicu.airetrain.monitor;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * (|μb − μc| / σb + |σb − σc| / σb) / 2, обрезано до 1.
 * При σb = 0 считаем дрейф нулевым.
 */
@Component
public class MeanShiftDriftScorer implements DriftScorer {

    @Override
    public String method() {
        return "mean-shift";
    }

    @Override
    public double score(List<Double> baseline, List<Double> current) {
        if (baseline == null || current == null || baseline.size() < 2 || current.size() < 2) return 0.0;

        double mb = mean(baseline);
        double mc = mean(current);
        double sb = std(baseline, mb);
        double sc = std(current, mc);

        if (sb <= 0) return 0.0;

        double meanDrift = Math.abs(mb - mc) / sb;
        double stdDrift = Math.abs(sb - sc) / sb;

        return Math.min((meanDrift + stdDrift) / 2.0, 1.0);
    }

    static double mean(List<Double> xs) {
        double s = 0;
        for (double x : xs) s += x;
        return s / xs.size();
    }

    // выборочное (n-1)
    static double std(List<Double> xs, double mean) {
        double s = 0;
        for (double x : xs) s += (x - mean) * (x - mean);
        return Math.sqrt(s / (xs.size() - 1));
    }
}
