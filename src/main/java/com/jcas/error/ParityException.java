package com.jcas.error;

public class ParityException extends ParseException {
    public ParityException(String message, String token, int position) {
        super(message, token, position);
    }

    public ParityException(String message) {
        super(message);
    }
}
