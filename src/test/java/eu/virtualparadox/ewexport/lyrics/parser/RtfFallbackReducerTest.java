package eu.virtualparadox.ewexport.lyrics.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RtfFallbackReducerTest {

    private RtfFallbackReducer reducer;

    @BeforeEach
    void setUp() {
        reducer = new RtfFallbackReducer();
    }

    @Test
    void testStripsTablesAndControlWords() {
        final String rtf = "{\\rtf1\\ansi{\\fonttbl\\f0 Arial;}{\\colortbl;\\red0;}\\f0\\fs24 Hello\\par World}";

        assertThat(reducer.reduce(rtf)).isEqualTo("Hello\nWorld");
    }

    @Test
    void testDecodesUnicodeBeforeStrippingControlWords() {
        assertThat(reducer.reduce("{\\rtf1 Gl\\u228?dje}")).isEqualTo("Glädje");
    }

    @Test
    void testKeepsEscapedLiterals() {
        assertThat(reducer.reduce("{\\rtf1 \\{x\\} \\\\ y}")).isEqualTo("{x} \\ y");
    }
}
