package org.example.nucleicounter.script;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MacroStringsTest {

    @Test
    void escape_handlesSeparatorsQuotesAndControlCharacters() {
        assertThat(MacroStrings.escape("C:\\data\\img \"1\".tif")).isEqualTo("C:\\\\data\\\\img \\\"1\\\".tif");
        assertThat(MacroStrings.escape("a\nb\tc")).isEqualTo("a\\nb\\tc");
        assertThat(MacroStrings.escape("/plain/path.png")).isEqualTo("/plain/path.png");
    }

    @Test
    void quote_wrapsEscapedValue() {
        assertThat(MacroStrings.quote("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
    }

    @Test
    void number_isLocaleIndependent() {
        assertThat(MacroStrings.number(50)).isEqualTo("50");
        assertThat(MacroStrings.number(1.5)).isEqualTo("1.50");
    }

    @Test
    void displayName_acceptsBothSeparatorStyles() {
        assertThat(ImageNames.displayName("/data/run1/a.jpg")).isEqualTo("a.jpg");
        assertThat(ImageNames.displayName("C:\\data\\b.tif")).isEqualTo("b.tif");
        assertThat(ImageNames.displayName("c.png")).isEqualTo("c.png");
        assertThat(ImageNames.displayName("/data/dir/")).isEqualTo("dir");
    }

    @Test
    void displayName_keepsSpacesInsideTheName() {
        assertThat(ImageNames.displayName("/data/ a.jpg")).isEqualTo(" a.jpg");
        assertThat(ImageNames.displayName("/data/b.jpg ")).isEqualTo("b.jpg ");
        assertThat(ImageNames.displayName(" c.jpg")).isEqualTo(" c.jpg");
    }
}
