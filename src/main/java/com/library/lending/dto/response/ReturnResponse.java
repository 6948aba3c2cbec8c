package com.library.lending.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.library.lending.entity.CirculationStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReturnResponse(
    boolean success,
    String message,
    String bookId,
    CirculationStatus status,
    String reservedForId,
    String reservedForName
) {}
