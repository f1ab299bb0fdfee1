package com.swiftaudit.util;

import com.swiftaudit.util.TextDecodingUtils.DecodedText;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TextDecodingUtilsTest {

    @Test
    void shouldDecodePlainUtf8() {
        DecodedText decoded = TextDecodingUtils.decodeBestEffort("if (a) {} // 中文".getBytes(StandardCharsets.UTF_8));

        assertEquals("if (a) {} // 中文", decoded.text());
        assertEquals("UTF-8", decoded.charsetName());
        assertFalse(decoded.hadBom());
        assertNull(decoded.buildNotice("A.swift"));
    }

    @Test
    void shouldRoundTripBomAndCharset() {
        byte[] original = TextDecodingUtils.encode("if (a) {}", "UTF-16LE", true);
        DecodedText decoded = TextDecodingUtils.decodeBestEffort(original);

        assertEquals("if (a) {}", decoded.text());
        assertTrue(decoded.hadBom());
        assertArrayEquals(original, TextDecodingUtils.encode(decoded.text(), decoded.charsetName(), decoded.hadBom()));
        assertNotNull(decoded.buildNotice("A.swift"));
    }

    @Test
    void shouldFallBackToGb18030() {
        byte[] bytes = "// 注释\nif (a) {}".getBytes(Charset.forName("GB18030"));
        DecodedText decoded = TextDecodingUtils.decodeBestEffort(bytes);

        assertEquals("// 注释\nif (a) {}", decoded.text());
        assertTrue(decoded.usedFallbackCharset());
        assertTrue(decoded.buildNotice("A.swift").contains("GB18030"));
    }

    @Test
    void shouldHandleEmptyInput() {
        assertEquals("", TextDecodingUtils.decodeBestEffort(new byte[0]).text());
        assertEquals("", TextDecodingUtils.decodeBestEffort(null).text());
    }

    @Test
    void shouldFlagUndecodableBytesAsLossy() {
        byte[] bytes = {'i', 'f', ' ', '(', 'a', ')', ' ', '{', '}', '\n', '/', '/', ' ', (byte) 0xFF, '\n'};
        DecodedText decoded = TextDecodingUtils.decodeBestEffort(bytes);

        assertTrue(decoded.lossy());
        assertTrue(decoded.text().startsWith("if (a) {}"));
        assertTrue(decoded.buildNotice("A.swift").contains("不会写回"));
        assertFalse(TextDecodingUtils.decodeBestEffort("if (a) {}".getBytes(StandardCharsets.UTF_8)).lossy());
    }
}
