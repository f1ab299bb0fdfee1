package com.swiftaudit.rule.control;

import com.swiftaudit.model.SyntaxKind;
import org.springframework.stereotype.Component;

/**
 * 过滤控制语句匹配中的误报
 * <p>
 * 以下情况不算违规：
 * <ul>
 *   <li>匹配开头不是真正的关键字（位于字符串、注释中，或是 renderGif 这类标识符的一部分）</li>
 *   <li>最外层括号在条件中途就闭合了，例如 {@code if (a || b) && (c || d)} 或
 *       {@code if (min...max).contains(value)}，括号只包住了条件的一部分</li>
 * </ul>
 */
@Component
public class ParenWrapFalsePositiveFilter {

    public boolean isFalsePositive(String matchedText, SyntaxKind leadingKind) {
        if (leadingKind != SyntaxKind.KEYWORD) {
            return true;
        }

        int lastClosing = matchedText.lastIndexOf(')');
        if (lastClosing < 0) {
            return false;
        }

        // Depth 1 means the first-opened group; closing it before the end splits the condition
        int depth = 0;
        for (int i = 0; i < matchedText.length(); i++) {
            char c = matchedText.charAt(i);
            if (c == ')') {
                if (i != lastClosing && depth == 1) {
                    return true;
                }
                depth--;
            } else if (c == '(') {
                depth++;
            }
        }
        return false;
    }
}
