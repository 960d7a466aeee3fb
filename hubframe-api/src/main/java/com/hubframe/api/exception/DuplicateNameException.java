package com.hubframe.api.exception;

import lombok.Getter;

@Getter
public class DuplicateNameException extends HubException {

    private final String name;

    public DuplicateNameException(String name) {
        super("Plugin name already registered: " + name);
        this.name = name;
    }
}
