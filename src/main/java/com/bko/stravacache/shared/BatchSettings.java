package com.bko.stravacache.shared;

import java.time.Duration;

public record BatchSettings(int defaultMaxConcurrent, Duration jobTimeout) {
    public static BatchSettings defaults() {
        return new BatchSettings(3, Duration.ofSeconds(280));
    }
}
