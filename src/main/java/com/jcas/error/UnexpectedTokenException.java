package com.jcas.error;

public class UnexpectedTokenException extends ParseException {
    public UnexpectedTokenException(String message, String token, int position) {
        super(message, token, position);
    }

    public UnexpectedTokenException(String message) {
        super(message);
    }
}
