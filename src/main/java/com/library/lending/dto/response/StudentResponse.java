package com.library.lending.dto.response;

import java.time.Instant;

public record StudentResponse(
    String studentId,
    String displayName,
    Instant createdAt
) {}
