package org.example.nucleicounter.dto.response;

import lombok.Builder;
import lombok.Data;
import org.example.nucleicounter.model.ImageOutcome;
import org.example.nucleicounter.model.OutcomeStatus;
import org.example.nucleicounter.script.ImageNames;

@Data @Builder
public class ImageOutcomeResponse {
    private String image;
    private String name;
    private OutcomeStatus status;
    private Integer count;
    private String detail;

    public static ImageOutcomeResponse from(ImageOutcome o) {
        return ImageOutcomeResponse.builder()
                .image(o.image())
                .name(ImageNames.displayName(o.image()))
                .status(o.status())
                .count(o.count())
                .detail(o.detail())
                .build();
    }

    public String summaryLine() {
        return name + ": " + (count != null ? count : "Error");
    }
}
