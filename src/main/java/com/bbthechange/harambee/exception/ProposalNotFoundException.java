package com.bbthechange.harambee.exception;

public class ProposalNotFoundException extends ResourceNotFoundException {

    public ProposalNotFoundException(String message) {
        super(message);
    }
}
