package com.bko.stravacache.harvest.web.dto;

public record HarvestRequestDto(
        String athleteId,
        String mode,
        Integer year,
        Integer limit
) { }
