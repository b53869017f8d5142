package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.FactStatus;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.engine.primitive.MetricCatalog;
import com.investigator.engine.primitive.PrimitiveException;
import com.investigator.engine.provider.InMemoryResourceProvider;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.investigator.engine.test.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.*;

class SignalPrimitivesTest {

    private static final MetricCatalog CATALOG = MetricCatalog.standard();
    private static final PrimitiveParameters DB_CPU =
        new PrimitiveParameters(DB, "cpu", Duration.ofHours(1), "production");
    private static final PrimitiveParameters API_ERRORS =
        new PrimitiveParameters(API, "errors", Duration.ofHours(1), "production");

    // ========== Error Rate ==========

    @Test
    @DisplayName("Errors above five percent of requests are elevated")
    void testErrorRateElevated() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, PAYMENTS_API, "Errors", 10.0, 20.0);
        window(provider, PAYMENTS_API, "Invocations", 100.0, 100.0);

        Fact fact = new AnalyzeErrorRate(CATALOG).execute(API_ERRORS, provider.build(), NOW).get(0);

        assertThat(fact.status()).isEqualTo(FactStatus.OK);
        assertThat(fact.text("error_metric")).hasValue("AWS/Lambda/Errors");
        assertThat(fact.number("error_count")).hasValue(30.0);
        assertThat(fact.number("request_count")).hasValue(200.0);
        assertThat(fact.number("error_rate_percent")).hasValue(15.0);
        assertThat(fact.flag("elevated")).isTrue();
        assertThat(fact.text("error_trend")).hasValue("increasing");
    }

    @Test
    @DisplayName("A low error rate is reported but not elevated")
    void testErrorRateNormal() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, PAYMENTS_API, "Errors", 2.0, 2.0);
        window(provider, PAYMENTS_API, "Invocations", 100.0, 100.0);

        Fact fact = new AnalyzeErrorRate(CATALOG).execute(API_ERRORS, provider.build(), NOW).get(0);

        assertThat(fact.number("error_rate_percent")).hasValue(2.0);
        assertThat(fact.flag("elevated")).isFalse();
        assertThat(fact.observations()).containsKey("elevated");
    }

    @Test
    @DisplayName("Without a request count only the error total is reported")
    void testErrorRateWithoutRequests() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, PAYMENTS_API, "Errors", 4.0, 6.0);

        Fact fact = new AnalyzeErrorRate(CATALOG).execute(API_ERRORS, provider.build(), NOW).get(0);

        assertThat(fact.status()).isEqualTo(FactStatus.PARTIAL);
        assertThat(fact.number("error_count")).hasValue(10.0);
        assertThat(fact.observations()).doesNotContainKeys("error_rate_percent", "elevated");
    }

    @Test
    @DisplayName("No error datapoints is a NO_DATA failure")
    void testErrorRateNoData() throws Exception {
        Fact fact = new AnalyzeErrorRate(CATALOG).execute(API_ERRORS, InMemoryResourceProvider.empty(), NOW).get(0);

        assertThat(fact.status()).isEqualTo(FactStatus.FAILED);
        assertThat(fact.errorCode()).isEqualTo(PrimitiveException.NO_DATA);
    }

    // ========== Metric Signals ==========

    @Test
    @DisplayName("Latency is compared with the same window yesterday and carries no threshold")
    void testLatency() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, PAYMENTS_API, "Duration", 300.0, 400.0);
        yesterday(provider, PAYMENTS_API, "Duration", 100.0, 100.0);

        Fact fact = MetricSignal.latency(CATALOG).execute(API_ERRORS, provider.build(), NOW).get(0);

        assertThat(fact.primitive()).isEqualTo(PrimitiveName.ANALYZE_LATENCY);
        assertThat(fact.status()).isEqualTo(FactStatus.OK);
        assertThat(fact.text("provider_metric")).hasValue("AWS/Lambda/Duration");
        assertThat(fact.number("average")).hasValue(350.0);
        assertThat(fact.number("maximum")).hasValue(400.0);
        assertThat(fact.number("baseline_average")).hasValue(100.0);
        assertThat(fact.number("deviation_percent")).hasValue(250.0);
        assertThat(fact.observations()).doesNotContainKeys("threshold", "exceeds_threshold");
    }

    @Test
    @DisplayName("Latency without history is partial")
    void testLatencyWithoutBaseline() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, PAYMENTS_API, "Duration", 120.0, 130.0);

        Fact fact = MetricSignal.latency(CATALOG).execute(API_ERRORS, provider.build(), NOW).get(0);

        assertThat(fact.status()).isEqualTo(FactStatus.PARTIAL);
        assertThat(fact.number("average")).hasValue(125.0);
        assertThat(fact.observations()).doesNotContainKey("deviation_percent");
    }

    @Test
    @DisplayName("Any throttled request reaches the throttling threshold")
    void testThrottlingExceeded() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, PAYMENTS_API, "Throttles", 0.0, 5.0);
        yesterday(provider, PAYMENTS_API, "Throttles", 0.0, 0.0);

        Fact fact = MetricSignal.throttling(CATALOG).execute(API_ERRORS, provider.build(), NOW).get(0);

        assertThat(fact.primitive()).isEqualTo(PrimitiveName.EVALUATE_THROTTLING);
        assertThat(fact.number("threshold")).hasValue(1.0);
        assertThat(fact.number("total")).hasValue(5.0);
        assertThat(fact.flag("exceeds_threshold")).isTrue();
        assertThat(fact.number("deviation_percent")).hasValue(100.0);
    }

    @Test
    @DisplayName("No throttled requests stays under the threshold")
    void testThrottlingQuiet() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, PAYMENTS_API, "Throttles", 0.0, 0.0);
        yesterday(provider, PAYMENTS_API, "Throttles", 0.0, 0.0);

        Fact fact = MetricSignal.throttling(CATALOG).execute(API_ERRORS, provider.build(), NOW).get(0);

        assertThat(fact.flag("exceeds_threshold")).isFalse();
        assertThat(fact.observations()).containsEntry("exceeds_threshold", false);
        assertThat(fact.number("deviation_percent")).hasValue(0.0);
    }

    @Test
    @DisplayName("Replica lag peaking at thirty seconds or more exceeds the threshold")
    void testReplicationLagExceeded() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, ORDERS_DB, "ReplicaLag", 10.0, 45.0);
        yesterday(provider, ORDERS_DB, "ReplicaLag", 2.0, 2.0);

        Fact fact = MetricSignal.replicationLag(CATALOG).execute(DB_CPU, provider.build(), NOW).get(0);

        assertThat(fact.primitive()).isEqualTo(PrimitiveName.CHECK_REPLICATION_LAG);
        assertThat(fact.text("provider_metric")).hasValue("AWS/RDS/ReplicaLag");
        assertThat(fact.number("threshold")).hasValue(30.0);
        assertThat(fact.number("maximum")).hasValue(45.0);
        assertThat(fact.flag("exceeds_threshold")).isTrue();
        assertThat(fact.text("trend")).hasValue("increasing");
    }

    @Test
    @DisplayName("Small replica lag stays under the threshold")
    void testReplicationLagNormal() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, ORDERS_DB, "ReplicaLag", 5.0, 8.0);
        yesterday(provider, ORDERS_DB, "ReplicaLag", 5.0, 5.0);

        Fact fact = MetricSignal.replicationLag(CATALOG).execute(DB_CPU, provider.build(), NOW).get(0);

        assertThat(fact.flag("exceeds_threshold")).isFalse();
    }

    @Test
    @DisplayName("Cost trend reads billing charges regardless of resource type")
    void testCostTrendRising() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, ORDERS_DB, "EstimatedCharges", 100.0, 150.0);
        yesterday(provider, ORDERS_DB, "EstimatedCharges", 50.0, 50.0);

        Fact fact = MetricSignal.costTrend(CATALOG).execute(DB_CPU, provider.build(), NOW).get(0);

        assertThat(fact.primitive()).isEqualTo(PrimitiveName.ANALYZE_COST_TREND);
        assertThat(fact.text("provider_metric")).hasValue("AWS/Billing/EstimatedCharges");
        assertThat(fact.text("trend")).hasValue("increasing");
        assertThat(fact.number("deviation_percent")).hasValue(150.0);
        assertThat(fact.observations()).doesNotContainKey("exceeds_threshold");
    }

    @Test
    @DisplayName("Flat spend shows no trend or deviation")
    void testCostTrendFlat() throws Exception {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        window(provider, ORDERS_DB, "EstimatedCharges", 50.0, 50.0);
        yesterday(provider, ORDERS_DB, "EstimatedCharges", 50.0, 50.0);

        Fact fact = MetricSignal.costTrend(CATALOG).execute(DB_CPU, provider.build(), NOW).get(0);

        assertThat(fact.text("trend")).hasValue("stable");
        assertThat(fact.number("deviation_percent")).hasValue(0.0);
    }

    @Test
    @DisplayName("A signal with no datapoints is a NO_DATA failure")
    void testSignalNoData() throws Exception {
        Fact fact = MetricSignal.replicationLag(CATALOG).execute(DB_CPU, InMemoryResourceProvider.empty(), NOW).get(0);

        assertThat(fact.status()).isEqualTo(FactStatus.FAILED);
        assertThat(fact.errorCode()).isEqualTo(PrimitiveException.NO_DATA);
    }

    private static void window(InMemoryResourceProvider.Builder provider, String resourceId, String metric,
                               double first, double second) {
        provider.point(resourceId, metric, NOW.minus(Duration.ofMinutes(40)), first);
        provider.point(resourceId, metric, NOW.minus(Duration.ofMinutes(10)), second);
    }

    private static void yesterday(InMemoryResourceProvider.Builder provider, String resourceId, String metric,
                                  double first, double second) {
        provider.point(resourceId, metric, NOW.minus(Duration.ofMinutes(40)).minus(Duration.ofDays(1)), first);
        provider.point(resourceId, metric, NOW.minus(Duration.ofMinutes(10)).minus(Duration.ofDays(1)), second);
    }
}
