package com.example.presence.exception;

import com.example.presence.enums.ErrorKind;

public class ResourceNotFoundException extends PresenceException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
