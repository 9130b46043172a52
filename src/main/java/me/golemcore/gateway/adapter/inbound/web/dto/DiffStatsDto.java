package me.golemcore.gateway.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffStatsDto {
    private String sessionId;
    private int linesAdded;
    private int linesRemoved;
    private int linesChanged;
    private int filesChanged;
    private List<String> files;
    private String warning;
    private String action;
}
