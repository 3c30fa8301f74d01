package org.example.nucleicounter.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineSettings {

    // aliases read settings files written by the desktop tool
    @JsonAlias("fiji_path")
    private String enginePath;

    @JsonAlias("macro_path")
    private String customScriptPath;

    @Builder.Default
    private RecipeOptions recipe = new RecipeOptions();
}
