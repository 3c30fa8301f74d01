package org.example.nucleicounter.script;

import org.example.nucleicounter.model.ProcessingRecipe;
import org.example.nucleicounter.model.RecipeOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RecipeFragmentsTest {

    private static final String STANDALONE_MACRO = String.join("\n",
            "input = getArgument();",
            "setBatchMode(true);",
            "open(input);",
            "run(\"8-bit\");",
            "setAutoThreshold(\"Default dark\");",
            "run(\"Analyze Particles...\", \"size=20-Infinity show=Nothing clear\");",
            "print(\"Count: \" + nResults);",
            "run(\"Quit\");");

    @TempDir
    Path tmp;

    private RecipeFragments fragments;

    @BeforeEach
    void setUp() {
        fragments = new RecipeFragments(new MacroTemplateLoader(new DefaultResourceLoader()));
    }

    @Test
    void builtIn_defaults() {
        String fragment = fragments.builtIn(new RecipeOptions());

        assertThat(fragment)
                .contains("run(\"Gaussian Blur...\", \"sigma=2\");")
                .contains("setAutoThreshold(\"Otsu dark\");")
                .contains("run(\"Watershed\");")
                .contains("run(\"Analyze Particles...\", \"size=50-Infinity circularity=0.00-1.00 show=Nothing clear\");");
    }

    @Test
    void builtIn_appliesSizeBoundsAndSegmentationToggle() {
        RecipeOptions options = RecipeOptions.builder()
                .minSize(30)
                .maxSize(400.0)
                .minCircularity(0.5)
                .segmentation(false)
                .darkBackground(false)
                .thresholdMethod("Li")
                .build();

        String fragment = fragments.builtIn(options);

        assertThat(fragment)
                .contains("size=30-400 circularity=0.50-1.00")
                .contains("setAutoThreshold(\"Li\");")
                .contains("// segmentation disabled")
                .doesNotContain("Watershed");
    }

    @Test
    void stripBoilerplate_keepsOnlyProcessingSteps() {
        String stripped = RecipeFragments.stripBoilerplate(STANDALONE_MACRO);

        assertThat(stripped.lines()).containsExactly(
                "run(\"8-bit\");",
                "setAutoThreshold(\"Default dark\");",
                "run(\"Analyze Particles...\", \"size=20-Infinity show=Nothing clear\");");
    }

    @Test
    void resolve_usesCustomMacroWhenReadable() throws IOException {
        Path macro = Files.writeString(tmp.resolve("count.ijm"), STANDALONE_MACRO);

        String fragment = fragments.resolve(new ProcessingRecipe(new RecipeOptions(), macro));

        assertThat(fragment).contains("size=20-Infinity").doesNotContain("getArgument").doesNotContain("Gaussian Blur");
    }

    @Test
    void resolve_fallsBackToBuiltInWhenCustomMacroMissing() {
        String fragment = fragments.resolve(new ProcessingRecipe(new RecipeOptions(), tmp.resolve("missing.ijm")));

        assertThat(fragment).isEqualTo(fragments.builtIn(new RecipeOptions()));
    }

    @Test
    void resolve_fallsBackToBuiltInWhenNothingLeftAfterStripping() throws IOException {
        Path macro = Files.writeString(tmp.resolve("io-only.ijm"), "open(getArgument());\nprint(nResults);\n");

        String fragment = fragments.resolve(new ProcessingRecipe(new RecipeOptions(), macro));

        assertThat(fragment).contains("Analyze Particles").contains("Gaussian Blur");
    }

    @Test
    void resolve_ignoresCustomMacroWhenNotPreferred() throws IOException {
        Path macro = Files.writeString(tmp.resolve("count.ijm"), STANDALONE_MACRO);
        RecipeOptions options = RecipeOptions.builder().preferCustomScript(false).build();

        String fragment = fragments.resolve(new ProcessingRecipe(options, macro));

        assertThat(fragment).contains("Gaussian Blur");
    }
}
