package com.jcas.error;

public class InvalidVariableNameException extends CasException {
    public InvalidVariableNameException(String message) {
        super(message);
    }
}
