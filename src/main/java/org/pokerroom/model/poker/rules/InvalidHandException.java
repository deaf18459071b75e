package org.pokerroom.model.poker.rules;

/** Too few cards handed to the evaluator. Always a caller bug. */
public class InvalidHandException extends IllegalArgumentException {
    public static final String CODE = "INVALID_INPUT";

    public InvalidHandException(String message) {
        super(CODE + ": " + message);
    }
}
