package io.deskscale.settings;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScreenFactorsTest {

    @Test
    void testJoinUsesTwoDecimalsInMapOrder() {
        var factors = new LinkedHashMap<String, Double>();
        factors.put("eDP-1", 1.25);
        factors.put("HDMI-1", 1.0);

        assertEquals("eDP-1=1.25;HDMI-1=1.00", ScreenFactors.join(factors));
    }

    @Test
    void testParseSkipsMalformedPairs() {
        var parsed = ScreenFactors.parse("eDP-1=1.25;garbage;HDMI-1=abc;DP-2=2.00;");

        assertEquals(Map.of("eDP-1", 1.25, "DP-2", 2.0), parsed);
    }

    @Test
    void testParseEmptyString() {
        assertTrue(ScreenFactors.parse("").isEmpty());
    }

    @Test
    void testParseReadsBackJoinedValue() {
        var factors = new LinkedHashMap<String, Double>();
        factors.put("eDP-1", 1.75);
        factors.put("DP-1", 1.5);

        assertEquals(factors, ScreenFactors.parse(ScreenFactors.join(factors)));
    }

    @Test
    void testRepresentativeFactor() {
        assertEquals(1.5, ScreenFactors.representative(Map.of("eDP-1", 1.5)));
        assertEquals(1.25, ScreenFactors.representative(Map.of("eDP-1", 2.0, "ALL", 1.25)));
        assertEquals(1.0, ScreenFactors.representative(Map.of("eDP-1", 2.0, "HDMI-1", 1.5)));
        assertEquals(1.0, ScreenFactors.representative(Map.of()));
    }
}
