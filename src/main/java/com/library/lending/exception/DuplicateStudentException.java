package com.library.lending.exception;

public class DuplicateStudentException extends RuntimeException {

    public DuplicateStudentException(String studentId) {
        super("Student id already exists: " + studentId);
    }
}
