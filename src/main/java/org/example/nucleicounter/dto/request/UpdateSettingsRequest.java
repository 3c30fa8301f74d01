package org.example.nucleicounter.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.example.nucleicounter.model.EngineSettings;
import org.example.nucleicounter.model.RecipeOptions;

@Getter
@Setter
public class UpdateSettingsRequest {

    @NotBlank(message = "enginePath is required")
    private String enginePath;

    private String customScriptPath;

    @Valid
    private Recipe recipe;

    public EngineSettings toSettings() {
        RecipeOptions options = recipe == null ? new RecipeOptions() : recipe.toOptions();
        return EngineSettings.builder()
                .enginePath(enginePath.strip())
                .customScriptPath(customScriptPath == null || customScriptPath.isBlank() ? null : customScriptPath.strip())
                .recipe(options)
                .build();
    }

    @Getter
    @Setter
    public static class Recipe {
        @PositiveOrZero
        private Double minSize;
        @PositiveOrZero
        private Double maxSize;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private Double minCircularity;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private Double maxCircularity;
        @PositiveOrZero
        private Double blurSigma;
        private String thresholdMethod;
        private Boolean darkBackground;
        private Boolean segmentation;
        private Boolean preferCustomScript;

        RecipeOptions toOptions() {
            RecipeOptions o = new RecipeOptions();
            if (minSize != null) o.setMinSize(minSize);
            o.setMaxSize(maxSize);
            if (minCircularity != null) o.setMinCircularity(minCircularity);
            if (maxCircularity != null) o.setMaxCircularity(maxCircularity);
            if (blurSigma != null) o.setBlurSigma(blurSigma);
            if (thresholdMethod != null && !thresholdMethod.isBlank()) o.setThresholdMethod(thresholdMethod.strip());
            if (darkBackground != null) o.setDarkBackground(darkBackground);
            if (segmentation != null) o.setSegmentation(segmentation);
            if (preferCustomScript != null) o.setPreferCustomScript(preferCustomScript);
            return o;
        }
    }
}
