package com.investigator.engine.primitive;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Ordered observation map builder. Doubles are rounded to two decimals so
 * facts render the same way on every run.
 */
public final class Observations {
    
    private final Map<String, Object> values = new LinkedHashMap<>();
    
    private Observations() {
    }
    
    public static Observations create() {
        return new Observations();
    }
    
    public Observations put(String key, Object value) {
        if (value instanceof Double d) {
            values.put(key, round(d));
        } else if (value != null) {
            values.put(key, value);
        }
        return this;
    }
    
    public Observations put(String key, OptionalDouble value) {
        if (value.isPresent()) {
            values.put(key, round(value.getAsDouble()));
        }
        return this;
    }
    
    public Map<String, Object> build() {
        return values;
    }
    
    public static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
