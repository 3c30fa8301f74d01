package org.example.nucleicounter.script;

import lombok.RequiredArgsConstructor;
import org.example.nucleicounter.engine.ResultChannel;
import org.example.nucleicounter.model.ProcessingRecipe;
import org.example.nucleicounter.model.RunMode;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Builds the single ImageJ macro that processes a whole batch in one engine session.
 * <p>
 * The output depends only on the recipe, the image list and the run mode, apart from
 * the embedded result channel path.
 */
@Component
@RequiredArgsConstructor
public class ScriptSynthesizer {

    static final String BATCH = "batch";
    static final String IMAGE_BLOCK = "image-block";
    static final Set<String> BATCH_POINTS = Set.of("MODE", "RESULT_PATH", "IMAGE_BLOCKS", "TERMINATION");
    static final Set<String> BLOCK_POINTS = Set.of("INDEX", "TOTAL", "IMAGE_PATH", "IMAGE_NAME", "RECIPE", "CLOSE");

    private static final String RECIPE_INDENT = "        ";

    private final MacroTemplateLoader templates;
    private final RecipeFragments fragments;

    public String synthesize(ProcessingRecipe recipe, List<String> images, RunMode runMode, Path resultChannel) {
        if (images.isEmpty()) {
            throw new IllegalArgumentException("Cannot synthesize a macro for an empty batch");
        }
        String recipeFragment = MacroStrings.indent(fragments.resolve(recipe), RECIPE_INDENT);
        MacroTemplate block = templates.load(IMAGE_BLOCK, BLOCK_POINTS);

        String blocks = imageBlocks(block, images, recipeFragment, closeDirective(runMode))
                .collect(Collectors.joining("\n"));

        return templates.load(BATCH, BATCH_POINTS).render(Map.of(
                "MODE", modeDirective(runMode),
                "RESULT_PATH", MacroStrings.quote(resultChannel.toAbsolutePath().toString()),
                "IMAGE_BLOCKS", blocks,
                "TERMINATION", terminationDirective(runMode)
        ));
    }

    private static Stream<String> imageBlocks(MacroTemplate block, List<String> images, String recipeFragment,
                                              String close) {
        int total = images.size();
        return IntStream.range(0, total).mapToObj(i -> block.render(Map.of(
                "INDEX", String.valueOf(i + 1),
                "TOTAL", String.valueOf(total),
                "IMAGE_PATH", MacroStrings.quote(images.get(i)),
                "IMAGE_NAME", MacroStrings.quote(ResultChannel.identifierFor(images.get(i))),
                "RECIPE", recipeFragment,
                "CLOSE", close
        )));
    }

    static String modeDirective(RunMode runMode) {
        return switch (runMode) {
            case HEADLESS -> "setBatchMode(true);";
            case INSPECT -> "setBatchMode(false);";
        };
    }

    // Headless runs free each image once counted; inspect runs leave them up for review.
    static String closeDirective(RunMode runMode) {
        return switch (runMode) {
            case HEADLESS -> "close();";
            case INSPECT -> "// left open for inspection";
        };
    }

    static String terminationDirective(RunMode runMode) {
        return switch (runMode) {
            case HEADLESS -> "run(\"Close All\");\neval(\"script\", \"System.exit(0);\");";
            case INSPECT -> "showStatus(\"Nuclei count finished\");";
        };
    }
}
