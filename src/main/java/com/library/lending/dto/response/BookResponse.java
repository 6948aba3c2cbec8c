package com.library.lending.dto.response;

import com.library.lending.entity.CirculationStatus;

import java.time.Instant;

public record BookResponse(
    String bookId,
    String isbn,
    String title,
    CirculationStatus status,
    String holderId,
    String holderName,
    String reservedForId,
    String reservedForName,
    Instant createdAt,
    Instant updatedAt
) {}
