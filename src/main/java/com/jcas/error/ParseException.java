package com.jcas.error;

/**
 * Malformed input. Carries the offending token and its position in the preprocessed text
 * (-1 when the fault is not tied to a single position).
 */
public class ParseException extends CasException {
    private final int position;
    private final String token;

    public ParseException(String message, String token, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.token = token;
        this.position = position;
    }

    public ParseException(String message) {
        this(message, null, -1);
    }

    public int position() {
        return position;
    }

    public String token() {
        return token;
    }
}
