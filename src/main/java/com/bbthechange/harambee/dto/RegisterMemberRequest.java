package com.bbthechange.harambee.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Request DTO for adding a member to a group. The phone number must not belong to another member.
 */
@Data
public class RegisterMemberRequest {

    @NotBlank(message = "Phone number is required")
    @Pattern(regexp = "^\\+[1-9]\\d{8,14}$", message = "Phone number must be in E.164 format")
    private String phoneNumber;

    @NotBlank(message = "Full name is required")
    @Size(max = 100, message = "Full name must be at most 100 characters")
    private String fullName;

    @NotBlank(message = "Group ID is required")
    private String groupId;

    @Pattern(regexp = "^(MEMBER|LEADER|TREASURER)$", message = "Role must be MEMBER, LEADER or TREASURER")
    private String role;

    public RegisterMemberRequest() {}

    public RegisterMemberRequest(String phoneNumber, String fullName, String groupId, String role) {
        this.phoneNumber = phoneNumber;
        this.fullName = fullName;
        this.groupId = groupId;
        this.role = role;
    }
}
