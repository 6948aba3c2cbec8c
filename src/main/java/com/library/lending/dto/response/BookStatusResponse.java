package com.library.lending.dto.response;

import com.library.lending.entity.CirculationStatus;

/**
 * Result of scanning a book: its circulation fields plus an advisory message.
 * {@code message} is {@code null} for reserved books; callers read {@code status} instead.
 */
public record BookStatusResponse(
    String bookId,
    String title,
    CirculationStatus status,
    String holderId,
    String holderName,
    String reservedForId,
    String reservedForName,
    String message
) {}
