package com.investigator.core.provider;

import java.time.Instant;

public record MetricPoint(Instant timestamp, double value) {}
