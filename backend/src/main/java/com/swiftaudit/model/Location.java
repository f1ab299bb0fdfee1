package com.swiftaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 违规或修正在文件中的位置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Location {

    /** 文件相对路径 */
    private String file;

    /** 行号，从 1 开始 */
    private int line;

    /** 列号，从 1 开始 */
    private int character;

    /** 在原始文本中的字符偏移 */
    private int offset;

    /**
     * 根据字符偏移计算行列号
     */
    public static Location of(SwiftFile file, int offset) {
        String contents = file.getContents();
        int line = 1;
        int lineStart = 0;
        int limit = Math.min(offset, contents.length());
        for (int i = 0; i < limit; i++) {
            if (contents.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return Location.builder()
                .file(file.getRelativePath())
                .line(line)
                .character(offset - lineStart + 1)
                .offset(offset)
                .build();
    }
}
