package com.bbthechange.harambee.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastResult {
    private int sentCount;
    private int failedCount;
    private int totalRecipients;
}
