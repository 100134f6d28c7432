package com.bko.stravacache.harvest.web.dto;

import java.util.List;

public record BatchRequestDto(
        List<String> activityIds,
        String athleteId,
        Integer maxConcurrent,
        Boolean forceRefresh,
        Boolean includeStreams
) { }
