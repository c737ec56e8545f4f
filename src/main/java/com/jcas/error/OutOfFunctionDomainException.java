package com.jcas.error;

public class OutOfFunctionDomainException extends CasException {
    public OutOfFunctionDomainException(String message) {
        super(message);
    }
}
