package com.library.lending.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record QueueRequest(

    @NotBlank(message = "Book ID must not be blank")
    @Size(max = 50, message = "Book ID must not exceed 50 characters")
    String bookId,

    @NotBlank(message = "Student ID must not be blank")
    @Size(max = 50, message = "Student ID must not exceed 50 characters")
    String studentId
) {}
