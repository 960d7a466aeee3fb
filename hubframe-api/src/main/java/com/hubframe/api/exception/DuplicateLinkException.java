package com.hubframe.api.exception;

public class DuplicateLinkException extends HubException {

    public DuplicateLinkException(String fromDevice, String toDevice) {
        super("Link already exists: " + fromDevice + " -> " + toDevice);
    }
}
