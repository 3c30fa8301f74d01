package org.example.nucleicounter.script;

import lombok.extern.slf4j.Slf4j;
import org.example.nucleicounter.model.ProcessingRecipe;
import org.example.nucleicounter.model.RecipeOptions;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Produces the per-image processing fragment of a batch macro, either from a
 * caller-supplied macro file or from the built-in detection steps.
 * <p>
 * Whatever the source, the fragment must leave one row per detected nucleus in the
 * Results table; the batch block reads {@code nResults} right after it.
 */
@Slf4j
@Component
public class RecipeFragments {

    static final String BUILT_IN = "builtin-recipe";
    static final Set<String> BUILT_IN_POINTS = Set.of("SIGMA", "THRESHOLD", "SEGMENTATION", "SIZE", "CIRCULARITY");

    // I/O framing of a standalone macro; the batch macro supplies its own.
    private static final Pattern BOILERPLATE = Pattern.compile(
            "^\\s*(?:\\w+\\s*=\\s*)?(?:"
                    + "getArgument\\s*\\("
                    + "|open\\s*\\("
                    + "|print\\s*\\("
                    + "|saveAs\\s*\\("
                    + "|setBatchMode\\s*\\("
                    + "|run\\s*\\(\\s*\"Quit\""
                    + "|eval\\s*\\(\\s*\"script\""
                    + "|exit\\b"
                    + ").*$");

    private final MacroTemplateLoader templates;

    public RecipeFragments(MacroTemplateLoader templates) {
        this.templates = templates;
    }

    public String resolve(ProcessingRecipe recipe) {
        if (recipe.usesCustomScript()) {
            Path script = recipe.customScript();
            try {
                String fragment = stripBoilerplate(Files.readString(script, StandardCharsets.UTF_8));
                if (!fragment.isBlank()) {
                    log.debug("Using custom macro {}", script);
                    return fragment;
                }
                log.warn("Custom macro {} has no processing steps left after stripping I/O lines, using built-in recipe", script);
            } catch (IOException e) {
                log.warn("Could not read custom macro {} ({}), using built-in recipe", script, e.toString());
            }
        }
        return builtIn(recipe.options());
    }

    public String builtIn(RecipeOptions options) {
        String threshold = options.getThresholdMethod() == null || options.getThresholdMethod().isBlank()
                ? "Default"
                : options.getThresholdMethod().strip();
        if (options.isDarkBackground()) {
            threshold = threshold + " dark";
        }
        String maxSize = options.getMaxSize() == null ? "Infinity" : MacroStrings.number(options.getMaxSize());
        String circularity = String.format(Locale.ROOT, "%.2f-%.2f",
                options.getMinCircularity(), options.getMaxCircularity());

        return templates.load(BUILT_IN, BUILT_IN_POINTS).render(Map.of(
                "SIGMA", MacroStrings.number(options.getBlurSigma()),
                "THRESHOLD", MacroStrings.escape(threshold),
                "SEGMENTATION", options.isSegmentation() ? "run(\"Watershed\");" : "// segmentation disabled",
                "SIZE", MacroStrings.number(options.getMinSize()) + "-" + maxSize,
                "CIRCULARITY", circularity
        )).strip();
    }

    static String stripBoilerplate(String macro) {
        return macro.lines()
                .filter(line -> !BOILERPLATE.matcher(line).matches())
                .collect(Collectors.joining("\n"))
                .strip();
    }
}
