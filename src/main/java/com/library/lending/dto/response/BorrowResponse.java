package com.library.lending.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a borrow attempt. A refused borrow is a normal result with
 * {@code success = false}: {@code canQueue} is set when the book is on loan, and the
 * {@code reservedFor*} fields name the requester the book is being held for.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BorrowResponse(
    boolean success,
    String message,
    String bookId,
    String title,
    boolean canQueue,
    String reservedForId,
    String reservedForName
) {}
