package com.investigator.core.test;

import com.investigator.core.model.ResourceRef;
import com.investigator.core.provider.ChangeEvent;
import com.investigator.core.provider.ConnectivityResult;
import com.investigator.core.provider.ConsumerUsage;
import com.investigator.core.provider.MetricId;
import com.investigator.core.provider.MetricSeries;
import com.investigator.core.provider.PermissionCheck;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.QuotaUsage;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.ScalingState;
import com.investigator.core.provider.TimeWindow;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Failure injection for chaos testing of investigations.
 * Wraps a {@link ResourceProvider} and injects failures, delays or
 * runtime errors per capability.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * ResourceProvider chaotic = FailureInjector.wrap(provider)
 *     .failOn(ProviderCapability.SCALING_STATE, ProviderException.THROTTLED)
 *     .delayOn(ProviderCapability.CONNECTIVITY, Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 */
public class FailureInjector implements ResourceProvider {

    private final ResourceProvider delegate;
    private final Map<ProviderCapability, Supplier<ProviderException>> failures;
    private final Map<ProviderCapability, Duration> delays;
    private final Map<ProviderCapability, Supplier<RuntimeException>> crashes;
    private final Set<ProviderCapability> withheld;
    private final Supplier<ProviderException> globalFailure;
    private final double failureRate;
    private final Random random;
    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();

    private FailureInjector(Builder builder) {
        this.delegate = builder.delegate;
        this.failures = new EnumMap<>(builder.failures);
        this.delays = new EnumMap<>(builder.delays);
        this.crashes = new EnumMap<>(builder.crashes);
        this.withheld = builder.withheld.isEmpty()
            ? EnumSet.noneOf(ProviderCapability.class)
            : EnumSet.copyOf(builder.withheld);
        this.globalFailure = builder.globalFailure;
        this.failureRate = builder.failureRate;
        this.random = new Random(builder.seed);
    }

    public static Builder wrap(ResourceProvider delegate) {
        return new Builder(delegate);
    }

    public int getCallCount() {
        return callCount.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    @Override
    public Set<ProviderCapability> capabilities() {
        Set<ProviderCapability> advertised = EnumSet.noneOf(ProviderCapability.class);
        advertised.addAll(delegate.capabilities());
        advertised.removeAll(withheld);
        return advertised;
    }

    @Override
    public MetricSeries readMetricSeries(ResourceRef resource, MetricId metric, TimeWindow window)
            throws ProviderException {
        inject(ProviderCapability.METRIC_SERIES);
        return delegate.readMetricSeries(resource, metric, window);
    }

    @Override
    public List<ChangeEvent> readRecentChanges(ResourceRef resource, TimeWindow window) throws ProviderException {
        inject(ProviderCapability.CHANGE_HISTORY);
        return delegate.readRecentChanges(resource, window);
    }

    @Override
    public List<ResourceRef> readDependencies(ResourceRef resource) throws ProviderException {
        inject(ProviderCapability.DEPENDENCY_GRAPH);
        return delegate.readDependencies(resource);
    }

    @Override
    public Map<String, String> readConfiguration(ResourceRef resource) throws ProviderException {
        inject(ProviderCapability.CONFIGURATION);
        return delegate.readConfiguration(resource);
    }

    @Override
    public ConnectivityResult checkConnectivity(ResourceRef from, ResourceRef to) throws ProviderException {
        inject(ProviderCapability.CONNECTIVITY);
        return delegate.checkConnectivity(from, to);
    }

    @Override
    public ScalingState readScalingState(ResourceRef resource) throws ProviderException {
        inject(ProviderCapability.SCALING_STATE);
        return delegate.readScalingState(resource);
    }

    @Override
    public List<QuotaUsage> readQuotas(ResourceRef resource) throws ProviderException {
        inject(ProviderCapability.QUOTAS);
        return delegate.readQuotas(resource);
    }

    @Override
    public List<PermissionCheck> checkPermissions(ResourceRef resource, List<String> actions) throws ProviderException {
        inject(ProviderCapability.PERMISSIONS);
        return delegate.checkPermissions(resource, actions);
    }

    @Override
    public List<ConsumerUsage> readTopConsumers(ResourceRef resource, MetricId metric, TimeWindow window, int limit)
            throws ProviderException {
        inject(ProviderCapability.TOP_CONSUMERS);
        return delegate.readTopConsumers(resource, metric, window, limit);
    }

    private void inject(ProviderCapability capability) throws ProviderException {
        callCount.incrementAndGet();
        Duration delay = delays.get(capability);
        if (delay != null) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw ProviderException.resource(ProviderException.PROVIDER_UNREACHABLE, "Interrupted during injected delay");
            }
        }
        if (globalFailure != null) {
            failureCount.incrementAndGet();
            throw globalFailure.get();
        }
        Supplier<RuntimeException> crash = crashes.get(capability);
        if (crash != null) {
            failureCount.incrementAndGet();
            throw crash.get();
        }
        Supplier<ProviderException> failure = failures.get(capability);
        if (failure != null) {
            failureCount.incrementAndGet();
            throw failure.get();
        }
        if (failureRate > 0.0 && random.nextDouble() < failureRate) {
            failureCount.incrementAndGet();
            throw ProviderException.resource(ProviderException.THROTTLED, "Injected random failure on " + capability);
        }
    }

    /**
     * Builder for FailureInjector.
     */
    public static class Builder {
        private final ResourceProvider delegate;
        private final Map<ProviderCapability, Supplier<ProviderException>> failures =
            new EnumMap<>(ProviderCapability.class);
        private final Map<ProviderCapability, Duration> delays = new EnumMap<>(ProviderCapability.class);
        private final Map<ProviderCapability, Supplier<RuntimeException>> crashes =
            new EnumMap<>(ProviderCapability.class);
        private final Set<ProviderCapability> withheld = EnumSet.noneOf(ProviderCapability.class);
        private Supplier<ProviderException> globalFailure;
        private double failureRate;
        private long seed = 42L;

        private Builder(ResourceProvider delegate) {
            this.delegate = delegate;
        }

        /**
         * Fail every call for a capability with a resource-scoped error.
         */
        public Builder failOn(ProviderCapability capability, String errorCode) {
            failures.put(capability, () -> ProviderException.resource(errorCode, "Injected " + errorCode + " on " + capability));
            return this;
        }

        /**
         * Fail every call with a global error, as if credentials had expired.
         */
        public Builder failGlobally(String errorCode) {
            this.globalFailure = () -> ProviderException.global(errorCode, "Injected global " + errorCode);
            return this;
        }

        /**
         * Throw an unchecked exception from a capability, as a buggy client would.
         */
        public Builder crashOn(ProviderCapability capability, Supplier<RuntimeException> crash) {
            crashes.put(capability, crash);
            return this;
        }

        public Builder delayOn(ProviderCapability capability, Duration delay) {
            delays.put(capability, delay);
            return this;
        }

        /**
         * Stop advertising a capability.
         */
        public Builder withhold(ProviderCapability capability) {
            withheld.add(capability);
            return this;
        }

        /**
         * Fail a seeded random fraction of calls with a resource-scoped THROTTLED error.
         */
        public Builder withFailureRate(double rate, long seed) {
            if (rate < 0.0 || rate > 1.0) {
                throw new IllegalArgumentException("Failure rate must be between 0.0 and 1.0");
            }
            this.failureRate = rate;
            this.seed = seed;
            return this;
        }

        public FailureInjector build() {
            return new FailureInjector(this);
        }
    }
}
