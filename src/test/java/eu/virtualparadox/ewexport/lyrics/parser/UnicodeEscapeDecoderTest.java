package eu.virtualparadox.ewexport.lyrics.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UnicodeEscapeDecoderTest {

    @Test
    @DisplayName("Override table wins over the numeric value")
    void testOverrides() {
        assertThat(UnicodeEscapeDecoder.decode(8217)).isEqualTo("'");
        assertThat(UnicodeEscapeDecoder.decode(8220)).isEqualTo("\"");
        assertThat(UnicodeEscapeDecoder.decode(180)).isEqualTo("´");
        assertThat(UnicodeEscapeDecoder.decode(229)).isEqualTo("å");
    }

    @Test
    @DisplayName("Codes outside the table map to their code point")
    void testPlainCodePoint() {
        assertThat(UnicodeEscapeDecoder.decode(233)).isEqualTo("é");
        assertThat(UnicodeEscapeDecoder.decode(65)).isEqualTo("A");
    }

    @Test
    @DisplayName("Negative codes get 65536 added")
    void testNegative() {
        assertThat(UnicodeEscapeDecoder.decode(-3913)).isEqualTo(String.valueOf((char) 61623));
    }

    @Test
    @DisplayName("Codes that are no code point cannot be decoded")
    void testOutOfRange() {
        assertThat(UnicodeEscapeDecoder.decode(-70000)).isNull();
        assertThat(UnicodeEscapeDecoder.decode(0x110000)).isNull();
    }

    @Test
    @DisplayName("Escapes inside text are replaced, the placeholder is consumed")
    void testDecodeEscapes() {
        assertThat(UnicodeEscapeDecoder.decodeEscapes("Hall\\u229? d\\u228?r")).isEqualTo("Hallå där");
        assertThat(UnicodeEscapeDecoder.decodeEscapes("no escapes")).isEqualTo("no escapes");
    }

    @Test
    @DisplayName("Undecodable escapes are left untouched")
    void testUndecodableKept() {
        assertThat(UnicodeEscapeDecoder.decodeEscapes("x\\u9999999?y")).isEqualTo("x\\u9999999?y");
    }
}
