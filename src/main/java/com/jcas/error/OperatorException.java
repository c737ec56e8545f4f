package com.jcas.error;

public class OperatorException extends ParseException {
    public OperatorException(String message, String token, int position) {
        super(message, token, position);
    }

    public OperatorException(String message) {
        super(message);
    }
}
