package com.investigator.core.provider;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Time-ordered metric datapoints returned by a provider.
 */
public record MetricSeries(
    MetricId metric,
    List<MetricPoint> points
) {
    public static final double TREND_THRESHOLD_PERCENT = 10.0;
    
    public MetricSeries {
        points = points == null
            ? List.of()
            : points.stream().sorted(Comparator.comparing(MetricPoint::timestamp)).toList();
    }
    
    public boolean isEmpty() {
        return points.isEmpty();
    }
    
    public OptionalDouble average() {
        return points.stream().mapToDouble(MetricPoint::value).average();
    }
    
    public OptionalDouble max() {
        return points.stream().mapToDouble(MetricPoint::value).max();
    }
    
    public OptionalDouble min() {
        return points.stream().mapToDouble(MetricPoint::value).min();
    }
    
    public OptionalDouble sum() {
        return points.isEmpty()
            ? OptionalDouble.empty()
            : OptionalDouble.of(points.stream().mapToDouble(MetricPoint::value).sum());
    }
    
    public OptionalDouble latest() {
        return points.isEmpty()
            ? OptionalDouble.empty()
            : OptionalDouble.of(points.get(points.size() - 1).value());
    }
    
    /**
     * Compare the mean of the first half of the series to the mean of the second half.
     * 
     * @return "increasing" or "decreasing" beyond a 10% change, "stable" otherwise,
     *         "unknown" with fewer than two points
     */
    public String trend() {
        if (points.size() < 2) {
            return "unknown";
        }
        int mid = points.size() / 2;
        double firstHalf = points.subList(0, mid).stream().mapToDouble(MetricPoint::value).average().orElse(0.0);
        double secondHalf = points.subList(mid, points.size()).stream().mapToDouble(MetricPoint::value).average().orElse(0.0);
        if (firstHalf == 0.0) {
            return secondHalf > 0.0 ? "increasing" : "stable";
        }
        double changePercent = (secondHalf - firstHalf) / Math.abs(firstHalf) * 100.0;
        if (changePercent > TREND_THRESHOLD_PERCENT) {
            return "increasing";
        }
        if (changePercent < -TREND_THRESHOLD_PERCENT) {
            return "decreasing";
        }
        return "stable";
    }
}
