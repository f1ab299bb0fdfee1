package com.swiftaudit.model;

/**
 * 控制语句正则的一次匹配。
 * <p>
 * condition 只在使用捕获版本的模式时有值，是括号内的原始条件文本。
 */
public record StatementMatch(
        StatementKind kind,
        int offset,
        int length,
        String text,
        SyntaxKind leadingKind,
        String condition) {

    public TextRange range() {
        return new TextRange(offset, length);
    }
}
