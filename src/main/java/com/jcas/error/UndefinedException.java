package com.jcas.error;

public class UndefinedException extends CasException {
    public UndefinedException(String message) {
        super(message);
    }
}
