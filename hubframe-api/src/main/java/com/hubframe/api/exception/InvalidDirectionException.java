package com.hubframe.api.exception;

public class InvalidDirectionException extends HubException {

    public InvalidDirectionException(String value) {
        super("Invalid link direction: " + value);
    }
}
