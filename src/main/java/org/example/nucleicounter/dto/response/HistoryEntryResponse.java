package org.example.nucleicounter.dto.response;

import lombok.Builder;
import lombok.Data;
import org.example.nucleicounter.model.HistoryEntry;
import org.example.nucleicounter.model.OutcomeStatus;
import org.example.nucleicounter.script.ImageNames;

import java.time.Instant;

@Data @Builder
public class HistoryEntryResponse {
    private Long id;
    private Long batchId;
    private String image;
    private String filename;
    private Integer count;
    private OutcomeStatus status;
    private Instant timestamp;

    public static HistoryEntryResponse from(HistoryEntry e) {
        return HistoryEntryResponse.builder()
                .id(e.getId())
                .batchId(e.getBatchId())
                .image(e.getImage())
                .filename(ImageNames.displayName(e.getImage()))
                .count(e.getCount())
                .status(e.getStatus())
                .timestamp(e.getRecordedAt())
                .build();
    }
}
