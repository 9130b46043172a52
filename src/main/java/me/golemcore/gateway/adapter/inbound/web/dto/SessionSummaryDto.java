package me.golemcore.gateway.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDto {
    private String id;
    private String status;
    private int turnCount;
    private int budgetUsed;
    private boolean hasSummary;
    private int compactionCount;
    private String createdAt;
    private String updatedAt;
}
