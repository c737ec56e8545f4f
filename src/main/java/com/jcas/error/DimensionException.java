package com.jcas.error;

public class DimensionException extends CasException {
    public DimensionException(String message) {
        super(message);
    }
}
