package org.example.nucleicounter.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

public record ProcessingRecipe(RecipeOptions options, Path customScript) {

    public ProcessingRecipe {
        options = Objects.requireNonNullElseGet(options, RecipeOptions::new).copy();
    }

    public static ProcessingRecipe builtIn() {
        return new ProcessingRecipe(new RecipeOptions(), null);
    }

    public static ProcessingRecipe from(EngineSettings settings) {
        String custom = settings.getCustomScriptPath();
        Path customScript = (custom == null || custom.isBlank()) ? null : Paths.get(custom);
        return new ProcessingRecipe(settings.getRecipe(), customScript);
    }

    @Override
    public RecipeOptions options() {
        return options.copy();
    }

    public boolean usesCustomScript() {
        return customScript != null && options.isPreferCustomScript();
    }
}
