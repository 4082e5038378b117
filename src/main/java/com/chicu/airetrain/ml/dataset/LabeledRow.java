package com.chicu.airetrain.ml.dataset;

import java.util.List;

public record LabeledRow(List<Double> features, Double label) {
}
