package com.project.image.analysis.service.classification;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Ordered list of rules evaluated top to bottom. The first matching rule wins;
 * when none matches the fallback label is returned.
 */
public final class RuleChain<M, L> {

    private final List<ClassificationRule<M, L>> rules;
    private final L fallback;

    private RuleChain(List<ClassificationRule<M, L>> rules, L fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public static <M, L> Builder<M, L> builder() {
        return new Builder<>();
    }

    public L classify(M metrics) {
        for (ClassificationRule<M, L> rule : rules) {
            if (rule.matches(metrics)) {
                return rule.label();
            }
        }
        return fallback;
    }

    public List<ClassificationRule<M, L>> rules() {
        return rules;
    }

    public L fallback() {
        return fallback;
    }

    public static final class Builder<M, L> {
        private final List<ClassificationRule<M, L>> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder<M, L> when(String description, Predicate<M> condition, L label) {
            rules.add(new ClassificationRule<>(description, condition, label));
            return this;
        }

        public RuleChain<M, L> otherwise(L fallback) {
            return new RuleChain<>(rules, fallback);
        }
    }
}
