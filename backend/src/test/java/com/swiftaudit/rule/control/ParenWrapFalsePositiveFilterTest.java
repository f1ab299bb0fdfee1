package com.swiftaudit.rule.control;

import com.swiftaudit.model.SyntaxKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParenWrapFalsePositiveFilterTest {

    private final ParenWrapFalsePositiveFilter filter = new ParenWrapFalsePositiveFilter();

    @Test
    void shouldAcceptSingleWrappingGroup() {
        assertFalse(filter.isFalsePositive("if (condition) {", SyntaxKind.KEYWORD));
        assertFalse(filter.isFalsePositive("if(condition) {", SyntaxKind.KEYWORD));
        assertFalse(filter.isFalsePositive("guard (condition) else {", SyntaxKind.KEYWORD));
    }

    @Test
    void shouldAcceptNestedGroupsInsideWrappingGroup() {
        assertFalse(filter.isFalsePositive("if ((a || b) && (c || d)) {", SyntaxKind.KEYWORD));
        assertFalse(filter.isFalsePositive("if ((min...max).contains(value)) {", SyntaxKind.KEYWORD));
        assertFalse(filter.isFalsePositive("if (((a)) || b) {", SyntaxKind.KEYWORD));
    }

    @Test
    void shouldRejectGroupClosedBeforeEndOfCondition() {
        assertTrue(filter.isFalsePositive("if (a || b) && (c || d) {", SyntaxKind.KEYWORD));
        assertTrue(filter.isFalsePositive("if (min...max).contains(value) {", SyntaxKind.KEYWORD));
        assertTrue(filter.isFalsePositive("while (a) || (b) {", SyntaxKind.KEYWORD));
    }

    @Test
    void shouldRejectNonKeywordLeadingToken() {
        assertTrue(filter.isFalsePositive("if (condition) {", SyntaxKind.IDENTIFIER));
        assertTrue(filter.isFalsePositive("if (condition) {", SyntaxKind.STRING));
        assertTrue(filter.isFalsePositive("if (condition) {", SyntaxKind.COMMENT));
        assertTrue(filter.isFalsePositive("if (condition) {", null));
    }

    @Test
    void shouldHandleDegenerateText() {
        assertFalse(filter.isFalsePositive("", SyntaxKind.KEYWORD));
        assertFalse(filter.isFalsePositive("if x {", SyntaxKind.KEYWORD));
        assertFalse(filter.isFalsePositive("if () {", SyntaxKind.KEYWORD));
        assertFalse(filter.isFalsePositive(")", SyntaxKind.KEYWORD));
    }

    @Test
    void shouldReturnSameAnswerOnRepeatedCalls() {
        String text = "if (a || b) && (c || d) {";
        boolean first = filter.isFalsePositive(text, SyntaxKind.KEYWORD);
        assertEquals(first, filter.isFalsePositive(text, SyntaxKind.KEYWORD));
    }
}
