package com.library.lending.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangeSecretRequest(

    @NotBlank(message = "Current secret must not be blank")
    String currentSecret,

    @NotBlank(message = "New secret must not be blank")
    @Size(max = 255, message = "New secret must not exceed 255 characters")
    String newSecret
) {
    @Override
    public String toString() {
        return "ChangeSecretRequest[***]";
    }
}
