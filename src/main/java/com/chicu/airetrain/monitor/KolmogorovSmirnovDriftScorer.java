package com.chicu.airetrain.monitor;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Двухвыборочная статистика Колмогорова–Смирнова: sup |F_b(x) − F_c(x)|.
 */
@Component
public class KolmogorovSmirnovDriftScorer implements DriftScorer {

    @Override
    public String method() {
        return "ks";
    }

    @Override
    public double score(List<Double> baseline, List<Double> current) {
        if (baseline == null || current == null || baseline.isEmpty() || current.isEmpty()) return 0.0;

        double[] a = baseline.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        double[] b = current.stream().mapToDouble(Double::doubleValue).sorted().toArray();

        int i = 0;
        int j = 0;
        double d = 0.0;

        while (i < a.length && j < b.length) {
            double x = Math.min(a[i], b[j]);
            while (i < a.length && a[i] <= x) i++;
            while (j < b.length && b[j] <= x) j++;
            double fa = (double) i / a.length;
            double fb = (double) j / b.length;
            d = Math.max(d, Math.abs(fa - fb));
        }
        return d;
    }
}
