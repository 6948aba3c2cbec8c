package com.library.lending.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterStudentRequest(

    @NotBlank(message = "Student ID must not be blank")
    @Size(max = 50, message = "Student ID must not exceed 50 characters")
    String studentId,

    @NotBlank(message = "Display name must not be blank")
    @Size(max = 100, message = "Display name must not exceed 100 characters")
    String displayName,

    @NotBlank(message = "Secret must not be blank")
    @Size(max = 255, message = "Secret must not exceed 255 characters")
    String secret
) {
    @Override
    public String toString() {
        return "RegisterStudentRequest[studentId=" + studentId + ", displayName=" + displayName + "]";
    }
}
