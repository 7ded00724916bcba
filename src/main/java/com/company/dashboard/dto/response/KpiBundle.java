package com.company.dashboard.dto.response;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered metric-name to display-string map, with the rounded numeric value kept
 * alongside for programmatic consumers. Text-only entries have no raw value.
 */
public class KpiBundle {

    private final String scope;
    private final Map<String, String> values = new LinkedHashMap<>();
    private final Map<String, BigDecimal> raw = new LinkedHashMap<>();

    public KpiBundle(String scope) {
        this.scope = scope;
    }

    public KpiBundle put(String key, BigDecimal rawValue, String formatted) {
        values.put(key, formatted);
        raw.put(key, rawValue);
        return this;
    }

    public KpiBundle putText(String key, String text) {
        values.put(key, text);
        return this;
    }

    public String getScope() {
        return scope;
    }

    public String get(String key) {
        return values.get(key);
    }

    public BigDecimal getRaw(String key) {
        return raw.get(key);
    }

    public Map<String, String> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Map<String, BigDecimal> getRaw() {
        return Collections.unmodifiableMap(raw);
    }
}
