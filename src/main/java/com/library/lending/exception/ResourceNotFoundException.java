package com.library.lending.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String entityName, String id) {
        super(entityName + " not found with id " + id);
    }
}
