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
public class SessionDetailDto {
    private String id;
    private String status;
    private int budgetUsed;
    private int redoDepth;
    private int compactionCount;
    private int inputTokens;
    private int outputTokens;
    private String createdAt;
    private String updatedAt;
    private String handoffNotes;
    private List<TurnDto> turns;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TurnDto {
        private String id;
        private String kind;
        private int estimatedSize;
        private String createdAt;
        private List<MessageDto> messages;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageDto {
        private String id;
        private String role;
        private String content;
        private String timestamp;
        private List<String> toolCalls;
        private int attachments;
    }
}
