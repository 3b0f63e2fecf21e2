package org.csu.pytrans.compiler;

import org.csu.pytrans.compiler.lexer.TokenRule;
import org.csu.pytrans.compiler.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 规则表的顺序就是分类优先级，这里把顺序和每条规则的分类结果固定下来。
 */
public class TokenRuleTest {

    @Test
    void testRulePriorityOrder() {
        assertEquals(List.of(
                TokenRule.RESERVED_WORD,
                TokenRule.WORD,
                TokenRule.DIGITS,
                TokenRule.QUOTED_STRING,
                TokenRule.WHITESPACE,
                TokenRule.PUNCTUATION
        ), List.of(TokenRule.values()));
    }

    @Test
    void testClassifyFollowsPriority() {
        assertEquals(TokenType.KEYWORD, TokenRule.classify("def"));
        assertEquals(TokenType.KEYWORD, TokenRule.classify("print"));
        assertEquals(TokenType.IDENTIFIER, TokenRule.classify("main"));
        // 数字同时满足单词规则，单词规则优先
        assertEquals(TokenType.IDENTIFIER, TokenRule.classify("123"));
        assertEquals(TokenType.STRING_LITERAL, TokenRule.classify("\"Hello world\""));
        assertEquals(TokenType.WHITESPACE, TokenRule.classify(" \t\n"));
        assertEquals(TokenType.OPERATOR, TokenRule.classify("+="));
        assertEquals(TokenType.OPERATOR, TokenRule.classify("(\""));
    }

    @Test
    void testUnmatchedTextFallsBackToOperator() {
        assertEquals(TokenType.OPERATOR, TokenRule.classify(""));
        assertEquals(TokenType.OPERATOR, TokenRule.classify("a b"));
    }

    @Test
    void testDigitsRuleStillClassifiesAsNumber() {
        assertTrue(TokenRule.DIGITS.matchesWhole("2024"));
        assertFalse(TokenRule.DIGITS.matchesWhole("20x"));
        assertEquals(TokenType.NUMBER, TokenRule.DIGITS.type());
    }

    @Test
    void testReservedWordRuleMatchesWholeWordsOnly() {
        assertTrue(TokenRule.RESERVED_WORD.matchesWhole("def"));
        assertFalse(TokenRule.RESERVED_WORD.matchesWhole("define"));
        assertFalse(TokenRule.RESERVED_WORD.matchesWhole("print2"));
    }

    @Test
    void testNoRuleProducesUnknown() {
        for (TokenRule rule : TokenRule.values()) {
            assertNotEquals(TokenType.UNKNOWN, rule.type());
        }
    }
}
