package com.swiftaudit.model;

import java.util.List;

/**
 * 一个源文件的词法分类表，记号按偏移升序排列
 */
public record SyntaxMap(List<SyntaxToken> tokens) {

    public SyntaxMap {
        tokens = List.copyOf(tokens);
    }

    public static SyntaxMap empty() {
        return new SyntaxMap(List.of());
    }

    /**
     * 返回覆盖给定偏移的记号分类；偏移落在空白或标点上时返回 null
     */
    public SyntaxKind kindAt(int offset) {
        int low = 0;
        int high = tokens.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            SyntaxToken token = tokens.get(mid);
            if (token.end() <= offset) {
                low = mid + 1;
            } else if (token.offset() > offset) {
                high = mid - 1;
            } else {
                return token.kind();
            }
        }
        return null;
    }
}
