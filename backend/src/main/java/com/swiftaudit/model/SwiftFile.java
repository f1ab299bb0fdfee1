package com.swiftaudit.model;

import com.swiftaudit.util.TextDecodingUtils;
import com.swiftaudit.util.TextDecodingUtils.DecodedText;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 待审查的 Swift 源文件
 * <p>
 * 上传的脚本没有磁盘路径，{@link #write(String)} 此时只更新内存中的内容。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwiftFile {

    /** 磁盘上的绝对路径，上传内容为 null */
    private Path path;

    /** 相对路径（相对于扫描根目录），用于报告展示 */
    private String relativePath;

    /** 当前文件内容 */
    private String contents;

    /** 读取时使用的编码，写回时沿用 */
    @Builder.Default
    private String charsetName = StandardCharsets.UTF_8.name();

    /** 原文件是否带 BOM */
    private boolean hadBom;

    /** 读取时有字节无法解码，内容已不是原文，禁止写回磁盘 */
    private boolean lossyDecode;

    /** 读取时的编码提示，没有则为 null */
    private String decodeNotice;

    public static SwiftFile load(Path file, Path root) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        DecodedText decoded = TextDecodingUtils.decodeBestEffort(bytes);
        String relative = root != null ? root.relativize(file).toString() : file.getFileName().toString();
        return SwiftFile.builder()
                .path(file)
                .relativePath(relative)
                .contents(decoded.text())
                .charsetName(decoded.charsetName())
                .hadBom(decoded.hadBom())
                .lossyDecode(decoded.lossy())
                .decodeNotice(decoded.buildNotice(relative))
                .build();
    }

    public static SwiftFile inMemory(String contents, String fileName) {
        return SwiftFile.builder()
                .relativePath(fileName)
                .contents(contents == null ? "" : contents)
                .build();
    }

    /**
     * 写回新内容。写入失败或文件无法无损写回时抛出 IOException，内存中的内容保持不变。
     */
    public void write(String newContents) throws IOException {
        if (path != null && lossyDecode) {
            throw new IOException("文件含有无法识别的字节，拒绝写回: " + relativePath);
        }
        if (path != null) {
            Files.write(path, TextDecodingUtils.encode(newContents, charsetName, hadBom));
        }
        this.contents = newContents;
    }
}
