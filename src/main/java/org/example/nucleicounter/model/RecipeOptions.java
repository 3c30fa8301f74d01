package org.example.nucleicounter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecipeOptions {

    @Builder.Default
    private double minSize = 50;

    // null means unbounded
    private Double maxSize;

    @Builder.Default
    private double minCircularity = 0.0;

    @Builder.Default
    private double maxCircularity = 1.0;

    @Builder.Default
    private double blurSigma = 2.0;

    @Builder.Default
    private String thresholdMethod = "Otsu";

    @Builder.Default
    private boolean darkBackground = true;

    @Builder.Default
    private boolean segmentation = true;

    @Builder.Default
    private boolean preferCustomScript = true;

    public RecipeOptions copy() {
        return toBuilder().build();
    }
}
