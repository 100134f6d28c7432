package com.bko.stravacache.harvest.web.dto;

public record ClearCacheDto(int deleted, String message) { }
