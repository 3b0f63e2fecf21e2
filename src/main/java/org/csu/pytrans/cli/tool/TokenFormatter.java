package org.csu.pytrans.cli.tool;

import org.csu.pytrans.compiler.lexer.Token;

import java.util.List;

/**
 * 把 Token 列表格式化为控制台输出，每行一个。
 */
public class TokenFormatter {

    /**
     * @param tokens 词法分析结果
     * @return 形如 {@code Token(main, Type: IDENTIFIER)} 的多行文本，空白字符转义后显示
     */
    public static String format(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return "No tokens.";
        }
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append("Token(")
                    .append(visible(token.text()))
                    .append(", Type: ")
                    .append(token.kind())
                    .append(")\n");
        }
        return sb.toString();
    }

    static String visible(String text) {
        return text.replace("\r", "\\r")
                .replace("\n", "\\n")
                .replace("\t", "\\t");
    }
}
