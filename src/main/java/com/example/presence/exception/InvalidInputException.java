package com.example.presence.exception;

import com.example.presence.enums.ErrorKind;

/**
 * Malformed caller input. Raised before the decision engine runs; no event is recorded.
 */
public class InvalidInputException extends PresenceException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
