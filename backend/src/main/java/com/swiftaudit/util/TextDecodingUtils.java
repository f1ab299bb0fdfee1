package com.swiftaudit.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 源文件编解码工具：优先 UTF-8，失败时回退到常见中文编码；
 * 写回时沿用读取时的编码与 BOM，保证自动修正不改变文件编码。
 */
public final class TextDecodingUtils {

    private static final Charset GB18030 = Charset.forName("GB18030");
    private static final Charset GBK = Charset.forName("GBK");

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] UTF16LE_BOM = {(byte) 0xFF, (byte) 0xFE};
    private static final byte[] UTF16BE_BOM = {(byte) 0xFE, (byte) 0xFF};

    private TextDecodingUtils() {
    }

    public static DecodedText decodeBestEffort(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new DecodedText("", StandardCharsets.UTF_8.name(), false, false, false);
        }

        if (hasPrefix(bytes, UTF8_BOM)) {
            return withoutBom(bytes, UTF8_BOM.length, StandardCharsets.UTF_8);
        }
        if (hasPrefix(bytes, UTF16LE_BOM)) {
            return withoutBom(bytes, UTF16LE_BOM.length, StandardCharsets.UTF_16LE);
        }
        if (hasPrefix(bytes, UTF16BE_BOM)) {
            return withoutBom(bytes, UTF16BE_BOM.length, StandardCharsets.UTF_16BE);
        }

        String utf8 = tryStrictDecode(bytes, StandardCharsets.UTF_8);
        if (utf8 != null) {
            return new DecodedText(utf8, StandardCharsets.UTF_8.name(), false, false, false);
        }

        for (Charset charset : List.of(GB18030, GBK)) {
            String decoded = tryStrictDecode(bytes, charset);
            if (decoded != null) {
                return new DecodedText(decoded, charset.name(), true, false, false);
            }
        }

        // 最后兜底，避免直接失败；非法字节已被替换，不能再按原样写回
        return new DecodedText(new String(bytes, StandardCharsets.UTF_8), StandardCharsets.UTF_8.name(), true, false, true);
    }

    /**
     * 按原编码把文本编码回字节，原文件带 BOM 时补回 BOM
     */
    public static byte[] encode(String text, String charsetName, boolean withBom) {
        Charset charset = charsetName == null ? StandardCharsets.UTF_8 : Charset.forName(charsetName);
        byte[] body = text.getBytes(charset);
        if (!withBom) {
            return body;
        }
        byte[] bom = bomFor(charset);
        byte[] result = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, result, 0, bom.length);
        System.arraycopy(body, 0, result, bom.length, body.length);
        return result;
    }

    private static byte[] bomFor(Charset charset) {
        if (StandardCharsets.UTF_16LE.equals(charset)) {
            return UTF16LE_BOM;
        }
        if (StandardCharsets.UTF_16BE.equals(charset)) {
            return UTF16BE_BOM;
        }
        if (StandardCharsets.UTF_8.equals(charset)) {
            return UTF8_BOM;
        }
        return new byte[0];
    }

    private static DecodedText withoutBom(byte[] bytes, int bomLength, Charset charset) {
        return new DecodedText(
                new String(bytes, bomLength, bytes.length - bomLength, charset),
                charset.name(),
                false,
                true,
                false);
    }

    private static String tryStrictDecode(byte[] bytes, Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static boolean hasPrefix(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param lossy 没有任何编码能无损解码，text 中含替换字符
     */
    public record DecodedText(String text, String charsetName, boolean usedFallbackCharset, boolean hadBom,
                              boolean lossy) {
        public String buildNotice(String fileName) {
            if (lossy) {
                return "检测到 " + fileName + " 含有无法识别的字节，已按 UTF-8 容错读取，该文件不会写回修正。";
            }
            if (usedFallbackCharset) {
                return "检测到 " + fileName + " 可能不是 UTF-8 编码，已自动按 " + charsetName + " 解码，修正后按原编码写回。";
            }
            if (hadBom && !StandardCharsets.UTF_8.name().equals(charsetName)) {
                return "检测到 " + fileName + " 使用 " + charsetName + " 编码，已自动处理。";
            }
            return null;
        }
    }
}
