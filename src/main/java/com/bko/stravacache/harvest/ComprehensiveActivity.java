package com.bko.stravacache.harvest;

import java.time.Instant;

public record ComprehensiveActivity(ActivityBundle data, boolean fromCache, Instant cachedAt) {
}
