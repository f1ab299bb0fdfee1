package com.swiftaudit.model;

/**
 * 源文本中的一段区间（UTF-16 偏移）
 */
public record TextRange(int offset, int length) {

    public int end() {
        return offset + length;
    }
}
