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
public class QualityGateReportDto {
    private boolean enabled;
    private boolean passed;
    private List<CheckDto> checks;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CheckDto {
        private String name;
        private String command;
        private boolean passed;
        private boolean required;
        private int exitCode;
        private String stdout;
        private String stderr;
    }
}
