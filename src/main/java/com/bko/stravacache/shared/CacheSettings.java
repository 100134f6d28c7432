package com.bko.stravacache.shared;

import java.nio.file.Path;

public record CacheSettings(Path rootDirectory) {
}
