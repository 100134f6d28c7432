package com.bko.stravacache.integrations.strava;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpstreamRateLimitTest {

    @Test
    void parsesUsageAndLimitHeaders() {
        UpstreamRateLimit parsed = UpstreamRateLimit.parse("45, 310", "100,1000").orElseThrow();

        assertEquals(45, parsed.shortWindowUsage());
        assertEquals(310, parsed.longWindowUsage());
        assertEquals(100, parsed.shortWindowLimit());
        assertEquals(1000, parsed.longWindowLimit());
    }

    @Test
    void missingLimitKeepsUsage() {
        UpstreamRateLimit parsed = UpstreamRateLimit.parse("3,7", null).orElseThrow();

        assertEquals(3, parsed.shortWindowUsage());
        assertNull(parsed.shortWindowLimit());
        assertNull(parsed.longWindowLimit());
    }

    @Test
    void malformedUsageIsIgnored() {
        assertTrue(UpstreamRateLimit.parse(null, "100,1000").isEmpty());
        assertTrue(UpstreamRateLimit.parse("12", "100,1000").isEmpty());
        Optional<UpstreamRateLimit> garbage = UpstreamRateLimit.parse("a,b", "100,1000");
        assertTrue(garbage.isEmpty());
    }
}
