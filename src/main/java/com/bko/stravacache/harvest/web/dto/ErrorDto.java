package com.bko.stravacache.harvest.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDto(String error, String details) {
    public ErrorDto(String error) {
        this(error, null);
    }
}
