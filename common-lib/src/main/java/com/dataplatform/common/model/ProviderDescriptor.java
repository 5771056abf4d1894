package com.dataplatform.common.model;

import com.dataplatform.common.exception.ErrorKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Static description of one external source, built at start-up from the catalog.
 *
 * <p>Everything is immutable except {@link #reliabilityScore()}, which is an exponential
 * moving average of observed outcomes. It changes only through {@link #recordOutcome}
 * under this descriptor's own lock, so unrelated providers never contend. Readers see a
 * volatile snapshot; lost updates under heavy concurrency are acceptable for a soft signal.
 */
public final class ProviderDescriptor {

    /** Weight of the newest observation in the reliability moving average. */
    public static final double SMOOTHING = 0.1;

    private final String                        id;
    private final String                        displayName;
    private final ProviderCategory              category;
    private final ProviderScope                 scope;
    private final Set<DataType>                 supportedDataTypes;
    private final RateLimitSpec                 rateLimit;
    private final double                        costPerRequest;
    private final double                        monthlyBudget;
    private final Duration                      timeout;
    private final Predicate<FilterCriteria>     activationPredicate;
    private final ToIntFunction<FilterCriteria> priorityFn;

    private final Object reliabilityLock = new Object();
    private volatile double reliabilityScore;

    private ProviderDescriptor(Builder b) {
        this.id                  = Objects.requireNonNull(b.id, "id");
        this.displayName         = b.displayName == null ? b.id : b.displayName;
        this.category            = Objects.requireNonNull(b.category, "category");
        this.scope               = Objects.requireNonNull(b.scope, "scope");
        this.supportedDataTypes  = b.supportedDataTypes.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(b.supportedDataTypes));
        this.rateLimit           = Objects.requireNonNull(b.rateLimit, "rateLimit");
        this.costPerRequest      = b.costPerRequest;
        this.monthlyBudget       = b.monthlyBudget;
        this.timeout             = b.timeout == null ? Duration.ofSeconds(5) : b.timeout;
        this.activationPredicate = b.activationPredicate == null ? f -> true : b.activationPredicate;
        this.priorityFn          = b.priorityFn == null ? f -> 0 : b.priorityFn;
        this.reliabilityScore    = clamp(b.reliabilityScore);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id()                                     { return id; }
    public String displayName()                            { return displayName; }
    public ProviderCategory category()                     { return category; }
    public ProviderScope scope()                           { return scope; }
    public Set<DataType> supportedDataTypes()              { return supportedDataTypes; }
    public RateLimitSpec rateLimit()                       { return rateLimit; }
    public double costPerRequest()                         { return costPerRequest; }
    public double monthlyBudget()                          { return monthlyBudget; }
    public Duration timeout()                              { return timeout; }
    public Predicate<FilterCriteria> activationPredicate() { return activationPredicate; }
    public ToIntFunction<FilterCriteria> priorityFn()      { return priorityFn; }
    public double reliabilityScore()                       { return reliabilityScore; }

    public boolean supports(DataType dataType) {
        return supportedDataTypes.contains(dataType);
    }

    public boolean isActiveFor(FilterCriteria criteria) {
        return activationPredicate.test(criteria);
    }

    public int priorityFor(FilterCriteria criteria) {
        return priorityFn.applyAsInt(criteria);
    }

    public boolean hasMonthlyBudget() {
        return category == ProviderCategory.COMMERCIAL && monthlyBudget > 0;
    }

    /**
     * The single mutation point for reliability.
     *
     * @param failure {@code null} on success, otherwise the classified failure
     * @return the updated score
     */
    public double recordOutcome(ErrorKind failure) {
        double observed = failure == null ? 1.0 : failure.reliabilityOutcome();
        synchronized (reliabilityLock) {
            double next = clamp((1.0 - SMOOTHING) * reliabilityScore + SMOOTHING * observed);
            reliabilityScore = next;
            return next;
        }
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public String toString() {
        return "ProviderDescriptor[" + id + ", " + category + "/" + scope
            + ", reliability=" + String.format("%.3f", reliabilityScore) + "]";
    }

    public static final class Builder {
        private final String id;
        private String displayName;
        private ProviderCategory category = ProviderCategory.COMMERCIAL;
        private ProviderScope scope = ProviderScope.INDIVIDUAL_ENTITY;
        private final Set<DataType> supportedDataTypes = EnumSet.noneOf(DataType.class);
        private RateLimitSpec rateLimit = RateLimitSpec.of(60, Duration.ofMinutes(1), 0);
        private double reliabilityScore = 0.9;
        private double costPerRequest;
        private double monthlyBudget;
        private Duration timeout;
        private Predicate<FilterCriteria> activationPredicate;
        private ToIntFunction<FilterCriteria> priorityFn;

        private Builder(String id) {
            this.id = id;
        }

        public Builder displayName(String v)                            { this.displayName = v; return this; }
        public Builder category(ProviderCategory v)                     { this.category = v; return this; }
        public Builder scope(ProviderScope v)                           { this.scope = v; return this; }
        public Builder rateLimit(RateLimitSpec v)                       { this.rateLimit = v; return this; }
        public Builder reliabilityScore(double v)                       { this.reliabilityScore = v; return this; }
        public Builder costPerRequest(double v)                         { this.costPerRequest = v; return this; }
        public Builder monthlyBudget(double v)                          { this.monthlyBudget = v; return this; }
        public Builder timeout(Duration v)                              { this.timeout = v; return this; }
        public Builder activationPredicate(Predicate<FilterCriteria> v) { this.activationPredicate = v; return this; }
        public Builder priorityFn(ToIntFunction<FilterCriteria> v)      { this.priorityFn = v; return this; }

        public Builder supports(DataType... types) {
            this.supportedDataTypes.addAll(Set.of(types));
            return this;
        }

        public Builder supports(Set<DataType> types) {
            this.supportedDataTypes.addAll(types);
            return this;
        }

        public ProviderDescriptor build() {
            return new ProviderDescriptor(this);
        }
    }
}
