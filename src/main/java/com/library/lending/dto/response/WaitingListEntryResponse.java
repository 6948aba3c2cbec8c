package com.library.lending.dto.response;

import java.time.Instant;

public record WaitingListEntryResponse(
    int position,
    String studentId,
    Instant enqueuedAt
) {}
