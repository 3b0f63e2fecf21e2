package org.csu.pytrans.compiler.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的源代码分解为一系列的Token。
 * 空白也会作为 Token 输出，所以所有 Token 的文本依次拼接后正好等于输入。
 */
public class Lexer {

    private static final Pattern TOKEN_PATTERN = TokenRule.scanningPattern();

    private final String input;

    public Lexer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，输入为空时返回空列表
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(input);
        while (matcher.find()) {
            String lexeme = matcher.group();
            tokens.add(new Token(TokenRule.classify(lexeme), lexeme));
        }
        return tokens;
    }
}
