package org.example.nucleicounter.dto.response;

import lombok.Builder;
import lombok.Data;
import org.example.nucleicounter.model.BatchSession;
import org.example.nucleicounter.model.BatchStatus;
import org.example.nucleicounter.model.RunMode;

import java.time.Instant;
import java.util.List;

@Data @Builder
public class BatchSessionResponse {
    private Long id;
    private BatchStatus status;
    private RunMode runMode;

    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;

    private Integer imageCount;
    private Integer countedTotal;
    private Integer failedTotal;
    private Long nucleiTotal;

    private Boolean engineMissing;
    private Boolean timedOut;
    private Integer exitCode;
    private String channelStatus;
    private String errorMessage;

    private List<ImageOutcomeResponse> outcomes;
    private List<String> summary;

    public static BatchSessionResponse from(BatchSession s, List<ImageOutcomeResponse> outcomes) {
        return BatchSessionResponse.builder()
                .id(s.getId())
                .status(s.getStatus())
                .runMode(s.getRunMode())
                .createdAt(s.getCreatedAt())
                .startedAt(s.getStartedAt())
                .finishedAt(s.getFinishedAt())
                .imageCount(s.getImageCount())
                .countedTotal(s.getCountedTotal())
                .failedTotal(s.getFailedTotal())
                .nucleiTotal(s.getNucleiTotal())
                .engineMissing(s.getEngineMissing())
                .timedOut(s.getTimedOut())
                .exitCode(s.getExitCode())
                .channelStatus(s.getChannelStatus())
                .errorMessage(s.getErrorMessage())
                .outcomes(outcomes)
                .summary(outcomes.stream().map(ImageOutcomeResponse::summaryLine).toList())
                .build();
    }
}
