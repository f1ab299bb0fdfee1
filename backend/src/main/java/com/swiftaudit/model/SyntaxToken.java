package com.swiftaudit.model;

/**
 * 单个词法记号：起始偏移、长度与分类
 */
public record SyntaxToken(int offset, int length, SyntaxKind kind) {

    public int end() {
        return offset + length;
    }

    public boolean covers(int position) {
        return position >= offset && position < end();
    }
}
