package com.jcas.error;

public class OutOfRangeException extends CasException {
    public OutOfRangeException(String message) {
        super(message);
    }
}
