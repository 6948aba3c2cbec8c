package com.library.lending.exception;

public class DuplicateBookException extends RuntimeException {

    public DuplicateBookException(String bookId) {
        super("Book id already exists: " + bookId);
    }
}
