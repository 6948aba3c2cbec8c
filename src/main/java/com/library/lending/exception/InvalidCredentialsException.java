package com.library.lending.exception;

public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String studentId) {
        super("Credential secret does not match for student " + studentId);
    }
}
