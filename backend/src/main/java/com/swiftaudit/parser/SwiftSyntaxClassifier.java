package com.swiftaudit.parser;

import com.swiftaudit.model.SyntaxKind;
import com.swiftaudit.model.SyntaxMap;
import com.swiftaudit.model.SyntaxToken;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Swift 源码轻量词法分类器
 * <p>
 * 只识别规则需要区分的记号：关键字、标识符、字符串、注释、数字、属性和编译条件。
 * 空白与标点不产生记号。不做语法分析。
 */
@Component
public class SwiftSyntaxClassifier {

    private static final Set<String> KEYWORDS = Set.of(
            "associatedtype", "class", "deinit", "enum", "extension", "fileprivate",
            "func", "import", "init", "inout", "internal", "let", "open", "operator",
            "private", "precedencegroup", "protocol", "public", "rethrows", "static",
            "struct", "subscript", "typealias", "var",
            "break", "case", "catch", "continue", "default", "defer", "do", "else",
            "fallthrough", "for", "guard", "if", "in", "repeat", "return", "throw",
            "switch", "where", "while",
            "Any", "as", "async", "await", "false", "is", "nil", "self", "Self",
            "super", "throws", "true", "try");

    public SyntaxMap classify(String contents) {
        List<SyntaxToken> tokens = new ArrayList<>();
        int length = contents.length();
        int i = 0;

        while (i < length) {
            char c = contents.charAt(i);
            char next = (i + 1 < length) ? contents.charAt(i + 1) : 0;

            // Line comment
            if (c == '/' && next == '/') {
                int end = contents.indexOf('\n', i);
                end = end < 0 ? length : end;
                tokens.add(new SyntaxToken(i, end - i, SyntaxKind.COMMENT));
                i = end;
                continue;
            }

            // Block comment, may nest
            if (c == '/' && next == '*') {
                int end = skipBlockComment(contents, i);
                tokens.add(new SyntaxToken(i, end - i, SyntaxKind.COMMENT));
                i = end;
                continue;
            }

            // String literal, including raw #"..."# and multi-line """..."""
            if (c == '"' || (c == '#' && isRawStringStart(contents, i))) {
                int end = skipString(contents, i);
                tokens.add(new SyntaxToken(i, end - i, SyntaxKind.STRING));
                i = end;
                continue;
            }

            // `escaped` identifier
            if (c == '`') {
                int close = contents.indexOf('`', i + 1);
                int lineEnd = contents.indexOf('\n', i + 1);
                if (close > i && (lineEnd < 0 || close < lineEnd)) {
                    tokens.add(new SyntaxToken(i, close + 1 - i, SyntaxKind.IDENTIFIER));
                    i = close + 1;
                    continue;
                }
            }

            if ((c == '@' || c == '#') && isIdentifierStart(next)) {
                int end = scanWord(contents, i + 1);
                SyntaxKind kind = c == '@' ? SyntaxKind.ATTRIBUTE : SyntaxKind.BUILD_CONFIG;
                tokens.add(new SyntaxToken(i, end - i, kind));
                i = end;
                continue;
            }

            if (isIdentifierStart(c)) {
                int end = scanWord(contents, i);
                String word = contents.substring(i, end);
                boolean memberAccess = i > 0 && contents.charAt(i - 1) == '.';
                SyntaxKind kind = KEYWORDS.contains(word) && !memberAccess
                        ? SyntaxKind.KEYWORD
                        : SyntaxKind.IDENTIFIER;
                tokens.add(new SyntaxToken(i, end - i, kind));
                i = end;
                continue;
            }

            if (Character.isDigit(c)) {
                int end = scanNumber(contents, i);
                tokens.add(new SyntaxToken(i, end - i, SyntaxKind.NUMBER));
                i = end;
                continue;
            }

            i++;
        }

        return new SyntaxMap(tokens);
    }

    private int skipBlockComment(String contents, int start) {
        int depth = 0;
        int i = start;
        while (i < contents.length()) {
            if (contents.startsWith("/*", i)) {
                depth++;
                i += 2;
            } else if (contents.startsWith("*/", i)) {
                depth--;
                i += 2;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return contents.length();
    }

    /**
     * 返回字符串字面量结束后的位置；未闭合的单行字符串在行尾结束
     */
    private int skipString(String contents, int start) {
        int length = contents.length();
        int i = start;
        int hashes = 0;
        while (i < length && contents.charAt(i) == '#') {
            hashes++;
            i++;
        }
        boolean multiline = contents.startsWith("\"\"\"", i);
        i += multiline ? 3 : 1;
        String delimiter = (multiline ? "\"\"\"" : "\"") + "#".repeat(hashes);

        while (i < length) {
            char c = contents.charAt(i);
            if (c == '\\' && hashes == 0) {
                if (i + 1 < length && contents.charAt(i + 1) == '(') {
                    i = skipInterpolation(contents, i + 1);
                } else {
                    i += 2;
                }
                continue;
            }
            if (!multiline && c == '\n') {
                return i;
            }
            if (contents.startsWith(delimiter, i)) {
                return i + delimiter.length();
            }
            i++;
        }
        return length;
    }

    /**
     * 跳过 \( ... ) 插值，插值内可以再出现字符串
     */
    private int skipInterpolation(String contents, int openParen) {
        int depth = 0;
        int i = openParen;
        while (i < contents.length()) {
            char c = contents.charAt(i);
            if (c == '"') {
                i = skipString(contents, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            } else if (c == '\n') {
                return i;
            }
            i++;
        }
        return contents.length();
    }

    private boolean isRawStringStart(String contents, int start) {
        int i = start;
        while (i < contents.length() && contents.charAt(i) == '#') {
            i++;
        }
        return i < contents.length() && contents.charAt(i) == '"';
    }

    private int scanWord(String contents, int start) {
        int i = start;
        while (i < contents.length() && isIdentifierPart(contents.charAt(i))) {
            i++;
        }
        return i;
    }

    private int scanNumber(String contents, int start) {
        int i = start;
        while (i < contents.length()) {
            char c = contents.charAt(i);
            boolean fraction = c == '.'
                    && i + 1 < contents.length()
                    && Character.isDigit(contents.charAt(i + 1));
            if (!isIdentifierPart(c) && !fraction) {
                break;
            }
            i++;
        }
        return i;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c < 128 && Character.isLetter(c));
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c < 128 && Character.isDigit(c));
    }
}
