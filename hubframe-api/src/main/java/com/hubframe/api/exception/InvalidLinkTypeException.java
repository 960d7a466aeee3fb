package com.hubframe.api.exception;

public class InvalidLinkTypeException extends HubException {

    public InvalidLinkTypeException(String value) {
        super("Invalid link type: " + value);
    }
}
