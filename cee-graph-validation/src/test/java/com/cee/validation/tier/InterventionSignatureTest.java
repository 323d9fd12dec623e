package com.cee.validation.tier;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InterventionSignatureTest {

    @Test
    void of_sortsEntriesAndFixesPrecision() {
        Map<String, Double> interventions = new LinkedHashMap<>();
        interventions.put("fac_time", 3.0);
        interventions.put("fac_cost", 1250.5);

        assertEquals("fac_cost:1250.5000|fac_time:3.0000", InterventionSignature.of(interventions));
    }

    @Test
    void of_emptyMapHasEmptySignature() {
        assertEquals("", InterventionSignature.of(Map.of()));
    }

    @Test
    void fixed4_roundsHalfUpOnExactValue() {
        assertEquals("0.1235", InterventionSignature.fixed4(0.12345678));
        assertEquals("2.0000", InterventionSignature.fixed4(1.99999));
        assertEquals("-1.5000", InterventionSignature.fixed4(-1.5));
        assertEquals("-0.0000", InterventionSignature.fixed4(-0.00001));
    }

    @Test
    void fixed4_nonFiniteValuesKeepTheirNames() {
        assertEquals("NaN", InterventionSignature.fixed4(Double.NaN));
        assertEquals("Infinity", InterventionSignature.fixed4(Double.POSITIVE_INFINITY));
        assertEquals("-Infinity", InterventionSignature.fixed4(Double.NEGATIVE_INFINITY));
    }
}
