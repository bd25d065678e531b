package com.bbthechange.harambee.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;

/**
 * Request DTO for opening a proposal to a group vote.
 * A missing or past voting deadline is replaced by the default voting period.
 */
@Data
public class CreateProposalRequest {

    @NotBlank(message = "Group ID is required")
    private String groupId;

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    @NotBlank(message = "Creator member ID is required")
    private String createdBy;

    private Instant votingDeadline;

    public CreateProposalRequest() {}

    public CreateProposalRequest(String groupId, String title, String description, String createdBy,
                                 Instant votingDeadline) {
        this.groupId = groupId;
        this.title = title;
        this.description = description;
        this.createdBy = createdBy;
        this.votingDeadline = votingDeadline;
    }
}
