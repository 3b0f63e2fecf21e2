package org.csu.pytrans.compiler.lexer;

import java.util.Objects;

/**
 * @param kind 词法单元的类型 (种别码)
 * @param text 词法单元的原始文本，非空；字符串常量包含两侧的双引号
 */
public record Token(TokenType kind, String text) {

    public Token {
        Objects.requireNonNull(kind, "Token kind must not be null");
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Token text must not be empty (kind " + kind + ")");
        }
    }

    public boolean is(TokenType type) {
        return kind == type;
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-14s, Text='%s']", kind, text);
    }
}
