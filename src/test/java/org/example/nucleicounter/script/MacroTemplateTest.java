package org.example.nucleicounter.script;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MacroTemplateTest {

    @Test
    void render_replacesEveryInsertionPoint() {
        MacroTemplate t = MacroTemplate.of("t", "a={{A}}; b={{B}}; again={{A}}", Set.of("A", "B"));

        assertThat(t.render(Map.of("A", "1", "B", "2"))).isEqualTo("a=1; b=2; again=1");
        assertThat(t.insertionPoints()).containsExactly("A", "B");
    }

    @Test
    void of_rejectsTemplateMissingRequiredInsertionPoint() {
        assertThatThrownBy(() -> MacroTemplate.of("broken", "setBatchMode(true);", Set.of("MODE")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("{{MODE}}");
    }

    @Test
    void render_failsOnUnresolvedPlaceholder() {
        MacroTemplate t = MacroTemplate.of("t", "{{A}} {{EXTRA}}", Set.of("A"));

        assertThatThrownBy(() -> t.render(Map.of("A", "x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("EXTRA");
    }

    @Test
    void render_doesNotRescanInsertedValues() {
        MacroTemplate t = MacroTemplate.of("t", "{{A}}|{{B}}", Set.of("A", "B"));

        assertThat(t.render(Map.of("A", "{{B}} $1 \\", "B", "b"))).isEqualTo("{{B}} $1 \\|b");
    }

    @Test
    void loader_readsBundledTemplates() {
        MacroTemplateLoader loader = new MacroTemplateLoader(new DefaultResourceLoader());

        MacroTemplate batch = loader.load(ScriptSynthesizer.BATCH, ScriptSynthesizer.BATCH_POINTS);
        MacroTemplate block = loader.load(ScriptSynthesizer.IMAGE_BLOCK, ScriptSynthesizer.BLOCK_POINTS);

        assertThat(batch.insertionPoints()).containsAll(ScriptSynthesizer.BATCH_POINTS);
        assertThat(block.insertionPoints()).containsAll(ScriptSynthesizer.BLOCK_POINTS);
    }

    @Test
    void loader_missingTemplate_shouldThrow() {
        MacroTemplateLoader loader = new MacroTemplateLoader(new DefaultResourceLoader());

        assertThatThrownBy(() -> loader.load("no_such_template", Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
