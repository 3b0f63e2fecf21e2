package org.csu.pytrans.compiler.lexer;

import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * @author hidyouth
 * @description: 词法规则表
 *
 * 枚举常量的声明顺序就是匹配优先级，也是分类优先级。
 * 扫描时所有规则拼成一个有序分支的正则；分类时按同样的顺序逐条整串匹配，
 * 第一条命中的规则决定 Token 类型。
 */
public enum TokenRule {

    RESERVED_WORD(Keywords.RESERVED_WORDS.stream()
            .map(word -> "\\b" + Pattern.quote(word) + "\\b")
            .collect(Collectors.joining("|")), TokenType.KEYWORD),
    WORD("\\w+", TokenType.IDENTIFIER),
    DIGITS("[0-9]+", TokenType.NUMBER),
    QUOTED_STRING("\".*?\"", TokenType.STRING_LITERAL),
    WHITESPACE("\\s+", TokenType.WHITESPACE),
    PUNCTUATION("[^\\w\\s]+", TokenType.OPERATOR);

    // 兜底类型：没有任何规则整串命中时使用
    private static final TokenType FALLBACK = TokenType.OPERATOR;

    private final String regex;
    private final Pattern pattern;
    private final TokenType type;

    TokenRule(String regex, TokenType type) {
        this.regex = regex;
        this.pattern = Pattern.compile(regex);
        this.type = type;
    }

    public TokenType type() {
        return type;
    }

    public boolean matchesWhole(String text) {
        return pattern.matcher(text).matches();
    }

    /**
     * 把所有规则按优先级拼接成一个扫描用的正则。
     */
    public static Pattern scanningPattern() {
        String alternation = Stream.of(values())
                .map(rule -> "(?:" + rule.regex + ")")
                .collect(Collectors.joining("|"));
        return Pattern.compile(alternation);
    }

    /**
     * 对一个已经匹配出来的词素重新分类。
     */
    public static TokenType classify(String text) {
        for (TokenRule rule : values()) {
            if (rule.matchesWhole(text)) {
                return rule.type;
            }
        }
        return FALLBACK;
    }
}
