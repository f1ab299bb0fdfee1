package com.swiftaudit.model;

/**
 * 词法分类结果，规则只关心某个偏移处是否为语言关键字
 */
public enum SyntaxKind {

    /** Swift 关键字（if、for、guard 等） */
    KEYWORD,

    /** 标识符，包括反引号转义的关键字 */
    IDENTIFIER,

    /** 字符串字面量（含多行、原始字符串） */
    STRING,

    /** 行注释或块注释 */
    COMMENT,

    NUMBER,

    /** 属性，如 @objc */
    ATTRIBUTE,

    /** 编译条件，如 #if DEBUG */
    BUILD_CONFIG
}
