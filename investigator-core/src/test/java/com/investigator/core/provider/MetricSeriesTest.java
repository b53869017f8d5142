package com.investigator.core.provider;

import com.investigator.core.exception.ParameterContractException;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.model.ResourceRef;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class MetricSeriesTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final MetricId CPU = new MetricId("AWS/RDS", "CPUUtilization", "Percent");

    @Test
    void trend_shouldDetectRisingSeries() {
        assertEquals("increasing", series(40, 42, 60, 70).trend());
        assertEquals("decreasing", series(80, 78, 50, 40).trend());
        assertEquals("stable", series(50, 51, 52, 50).trend());
        assertEquals("unknown", series(50).trend());
    }

    @Test
    void trend_fromZero_shouldTreatAnyRiseAsIncreasing() {
        assertEquals("increasing", series(0, 0, 5, 5).trend());
        assertEquals("stable", series(0, 0, 0, 0).trend());
    }

    @Test
    void constructor_shouldOrderPointsByTime() {
        MetricSeries series = new MetricSeries(CPU, List.of(
            new MetricPoint(NOW, 3.0),
            new MetricPoint(NOW.minusSeconds(120), 1.0),
            new MetricPoint(NOW.minusSeconds(60), 2.0)));
        
        assertEquals(3.0, series.latest().getAsDouble());
        assertEquals(2.0, series.average().getAsDouble());
        assertEquals(6.0, series.sum().getAsDouble());
    }

    @Test
    void emptySeries_shouldHaveNoAggregates() {
        MetricSeries series = new MetricSeries(CPU, null);
        
        assertTrue(series.isEmpty());
        assertTrue(series.max().isEmpty());
        assertTrue(series.sum().isEmpty());
    }

    @Test
    void timeWindow_shouldExcludeItsEnd() {
        TimeWindow window = TimeWindow.ending(NOW, Duration.ofHours(1));
        
        assertTrue(window.contains(NOW.minus(Duration.ofHours(1))));
        assertTrue(window.contains(NOW.minusSeconds(1)));
        assertFalse(window.contains(NOW));
        assertEquals(NOW.minus(Duration.ofDays(1)), window.shiftedBack(Duration.ofDays(1)).end());
        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(NOW, NOW));
    }

    @Test
    void providerException_shouldCarryScope() {
        ProviderException auth = ProviderException.authentication("token expired");
        ProviderException unsupported = ProviderException.unsupported(ProviderCapability.METRIC_SERIES);
        
        assertTrue(auth.isGlobal());
        assertEquals(ProviderException.AUTHENTICATION_FAILED, auth.getErrorCode());
        assertFalse(unsupported.isGlobal());
        assertEquals(ProviderException.UNSUPPORTED, unsupported.getErrorCode());
    }

    @Test
    void primitiveParameters_shouldRejectMissingResourceOrWindow() {
        assertThrows(ParameterContractException.class,
            () -> new PrimitiveParameters(null, "cpu", Duration.ofHours(1), "production"));
        assertThrows(ParameterContractException.class,
            () -> new PrimitiveParameters(ResourceRef.of("rds", null),
                "cpu", Duration.ofSeconds(-1), "production"));
    }
    
    private MetricSeries series(double... values) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(NOW.minusSeconds(60L * (values.length - i)), values[i]));
        }
        return new MetricSeries(CPU, points);
    }
}
