package com.bbthechange.harambee.model;

import com.bbthechange.harambee.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Purpose an OTP was issued for. A code is only accepted for the purpose it was issued with.
 */
public enum VerificationType {
    REGISTRATION("registration"),
    VOTING("voting"),
    PASSWORD_RESET("password_reset");

    private final String value;

    VerificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static VerificationType fromValue(String value) {
        if (value != null) {
            for (VerificationType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unknown verification type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
