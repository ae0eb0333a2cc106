package com.example.presence.exception;

import com.example.presence.enums.ErrorKind;

public class ConflictException extends PresenceException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
