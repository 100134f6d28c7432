package com.bko.stravacache.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.stereotype.Component;

@Component
public class EnvConfig {
    private final Dotenv dotenv;

    public EnvConfig() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
    }

    EnvConfig(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    public String get(String key) {
        String envKey = toEnvKey(key);
        String value = dotenv.get(envKey);
        if (value == null) {
            value = System.getenv(envKey);
        }
        return value == null ? null : value.trim();
    }

    static String toEnvKey(String key) {
        return key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
    }
}
