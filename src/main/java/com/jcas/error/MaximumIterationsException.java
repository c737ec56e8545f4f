package com.jcas.error;

public class MaximumIterationsException extends CasException {
    public MaximumIterationsException(String message) {
        super(message);
    }
}
