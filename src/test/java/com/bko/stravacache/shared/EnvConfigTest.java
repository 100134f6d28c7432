package com.bko.stravacache.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnvConfigTest {

    @Test
    void toEnvKeyUppercasesAndReplacesSeparators() {
        assertEquals("RATE_LIMIT_SAFETY_RATIO", EnvConfig.toEnvKey("rate_limit.safety-ratio"));
        assertEquals("CACHE_DIR", EnvConfig.toEnvKey("cache.dir"));
    }

    @Test
    void getReadsDotenvAndTrims() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get("CACHE_DIR")).thenReturn("  /var/cache/strava ");
        EnvConfig config = new EnvConfig(dotenv);

        assertEquals("/var/cache/strava", config.get("cache.dir"));
    }
}
