package com.project.image.analysis.service.classification;

import java.util.Objects;
import java.util.function.Predicate;

/** A single threshold rule: when {@code condition} holds for the metrics, the result is {@code label}. */
public record ClassificationRule<M, L>(String description, Predicate<M> condition, L label) {

    public ClassificationRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(label, "label");
    }

    public boolean matches(M metrics) {
        return condition.test(metrics);
    }
}
