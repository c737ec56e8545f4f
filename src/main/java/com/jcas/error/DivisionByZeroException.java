package com.jcas.error;

public class DivisionByZeroException extends CasException {
    public DivisionByZeroException(String message) {
        super(message);
    }
}
