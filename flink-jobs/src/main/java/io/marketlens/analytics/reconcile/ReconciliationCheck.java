package io.marketlens.analytics.reconcile;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Declares how a fact table is compared with its staging source: the date column on each side,
 * the fact table's filter predicates replayed on staging, and the summed metrics.
 *
 * @param <S> staging row type
 * @param <F> fact row type
 */
public final class ReconciliationCheck<S, F> {
    private final String name;
    private final Function<S, LocalDate> stagingDate;
    private final Function<F, LocalDate> factDate;
    private final Predicate<S> stagingFilter;
    private final List<Metric<S, F>> metrics;

    private ReconciliationCheck(Builder<S, F> builder) {
        this.name = builder.name;
        this.stagingDate = builder.stagingDate;
        this.factDate = builder.factDate;
        this.stagingFilter = builder.stagingFilter;
        this.metrics = List.copyOf(builder.metrics);
    }

    public static <S, F> Builder<S, F> builder(String name) {
        return new Builder<>(name);
    }

    public String name() {
        return name;
    }

    Function<S, LocalDate> stagingDate() {
        return stagingDate;
    }

    Function<F, LocalDate> factDate() {
        return factDate;
    }

    Predicate<S> stagingFilter() {
        return stagingFilter;
    }

    List<Metric<S, F>> metrics() {
        return metrics;
    }

    static final class Metric<S, F> {
        final String name;
        final Function<S, BigDecimal> staging;
        final Function<F, BigDecimal> fact;

        Metric(String name, Function<S, BigDecimal> staging, Function<F, BigDecimal> fact) {
            this.name = name;
            this.staging = staging;
            this.fact = fact;
        }
    }

    public static final class Builder<S, F> {
        private final String name;
        private Function<S, LocalDate> stagingDate;
        private Function<F, LocalDate> factDate;
        private Predicate<S> stagingFilter = row -> true;
        private final List<Metric<S, F>> metrics = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder<S, F> dates(Function<S, LocalDate> stagingDate, Function<F, LocalDate> factDate) {
            this.stagingDate = stagingDate;
            this.factDate = factDate;
            return this;
        }

        public Builder<S, F> stagingFilter(Predicate<S> stagingFilter) {
            this.stagingFilter = stagingFilter;
            return this;
        }

        public Builder<S, F> metric(String metric, Function<S, BigDecimal> staging, Function<F, BigDecimal> fact) {
            metrics.add(new Metric<>(metric, staging, fact));
            return this;
        }

        public ReconciliationCheck<S, F> build() {
            if (stagingDate == null || factDate == null) {
                throw new IllegalStateException("Check " + name + " needs date columns on both sides");
            }
            if (metrics.isEmpty()) {
                throw new IllegalStateException("Check " + name + " compares no metrics");
            }
            return new ReconciliationCheck<>(this);
        }
    }
}
