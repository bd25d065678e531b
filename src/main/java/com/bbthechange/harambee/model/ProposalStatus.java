package com.bbthechange.harambee.model;

public enum ProposalStatus {
    DRAFT,
    VOTING,
    PASSED,
    FAILED,
    EXECUTED
}
