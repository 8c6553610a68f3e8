package com.aiops.anomaly.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coerces extracted field values into numeric features.
 *
 * Numbers are used as-is and booleans count as 1 or 0. Text yields the first decimal or integer found anywhere in it,
 * so "500ms" becomes 500 and "1.5s" becomes 1.5. Anything else is not a feature.
 */
public final class NumericExtractor {

    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d*\\.\\d+|\\d+");

    private NumericExtractor() {}

    public static OptionalDouble extract(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        if (value instanceof Boolean flag) {
            return OptionalDouble.of(flag ? 1.0 : 0.0);
        }
        if (value instanceof CharSequence text) {
            Matcher m = NUMBER.matcher(text);
            if (m.find()) {
                return OptionalDouble.of(Double.parseDouble(m.group()));
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Keep only the fields that coerce to a number, preserving field order.
     */
    public static Map<String, Double> features(Map<String, ?> fields) {
        Map<String, Double> features = new LinkedHashMap<>();
        for (Map.Entry<String, ?> field : fields.entrySet()) {
            OptionalDouble value = extract(field.getValue());
            if (value.isPresent()) {
                features.put(field.getKey(), value.getAsDouble());
            }
        }
        return features;
    }
}
