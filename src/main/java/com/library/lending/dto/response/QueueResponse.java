package com.library.lending.dto.response;

public record QueueResponse(
    boolean success,
    String message,
    String bookId,
    long position
) {}
