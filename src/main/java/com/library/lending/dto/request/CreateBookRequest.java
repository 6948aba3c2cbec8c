package com.library.lending.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateBookRequest(

    @NotBlank(message = "Book ID must not be blank")
    @Size(max = 50, message = "Book ID must not exceed 50 characters")
    String bookId,

    @Pattern(regexp = "\\d{10}|\\d{13}", message = "ISBN must be 10 or 13 digits")
    String isbn,

    @NotBlank(message = "Title must not be blank")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    String title
) {}
