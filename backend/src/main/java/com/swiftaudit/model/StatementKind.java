package com.swiftaudit.model;

/**
 * 受检查的控制语句类型
 */
public enum StatementKind {

    IF("if"),
    FOR("for"),
    GUARD("guard"),
    SWITCH("switch"),
    WHILE("while");

    private final String keyword;

    StatementKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * 构造用于查找“条件被整体括号包裹”的正则表达式。
     * 括号内不允许出现逗号和左花括号，避免匹配 <code>if (a, b) == (0, 1) {</code> 这类元组比较。
     */
    public String wrappedConditionPattern() {
        return switch (this) {
            case GUARD -> keyword + "\\s*\\([^,{]*\\)\\s*else\\s*\\{";
            case IF, FOR, SWITCH, WHILE -> keyword + "\\s*\\([^,{]*\\)\\s*\\{";
        };
    }
}
