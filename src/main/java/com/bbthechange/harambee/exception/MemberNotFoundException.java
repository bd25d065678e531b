package com.bbthechange.harambee.exception;

public class MemberNotFoundException extends ResourceNotFoundException {

    public MemberNotFoundException(String message) {
        super(message);
    }
}
