package com.bbthechange.harambee.model;

public enum MemberRole {
    MEMBER,
    LEADER,
    TREASURER
}
