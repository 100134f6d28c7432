package com.bko.stravacache.harvest.web.dto;

import java.util.List;

public record EnrichRequestDto(
        String athleteId,
        List<String> activityIds
) { }
