package com.aiops.anomaly.parser;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NumericExtractorTest {

    @Test
    void extract_textWithUnitSuffix_takesLeadingNumber() {
        assertThat(NumericExtractor.extract("500ms").getAsDouble()).isEqualTo(500.0);
        assertThat(NumericExtractor.extract("1.5s").getAsDouble()).isEqualTo(1.5);
    }

    @Test
    void extract_textWithoutDigits_isEmpty() {
        assertThat(NumericExtractor.extract("timeout")).isEmpty();
        assertThat(NumericExtractor.extract("")).isEmpty();
    }

    @Test
    void extract_numbersUsedAsIs() {
        assertThat(NumericExtractor.extract(42).getAsDouble()).isEqualTo(42.0);
        assertThat(NumericExtractor.extract(0.07).getAsDouble()).isEqualTo(0.07);
    }

    @Test
    void extract_signedAndLeadingDotDecimals() {
        assertThat(NumericExtractor.extract("delta=-3.25").getAsDouble()).isEqualTo(-3.25);
        assertThat(NumericExtractor.extract(".5").getAsDouble()).isEqualTo(0.5);
    }

    @Test
    void extract_nonFiniteOrUnsupportedTypes_isEmpty() {
        assertThat(NumericExtractor.extract(Double.NaN)).isEmpty();
        assertThat(NumericExtractor.extract(null)).isEmpty();
    }

    @Test
    void extract_booleansCountAsOneOrZero() {
        assertThat(NumericExtractor.extract(Boolean.TRUE).getAsDouble()).isEqualTo(1.0);
        assertThat(NumericExtractor.extract(Boolean.FALSE).getAsDouble()).isEqualTo(0.0);
        assertThat(NumericExtractor.extract("true")).isEmpty();
    }

    @Test
    void features_keepsOnlyNumericFieldsInOrder() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("level", "ERROR");
        fields.put("resp_time", "1200ms");
        fields.put("ok", true);
        fields.put("bytes_out", 512);

        Map<String, Double> features = NumericExtractor.features(fields);

        assertThat(features).containsExactly(
                Map.entry("resp_time", 1200.0),
                Map.entry("bytes_out", 512.0));
    }
}
