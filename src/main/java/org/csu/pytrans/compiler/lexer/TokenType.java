package org.csu.pytrans.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 源语言只区分这几大类，具体的关键字由 {@link Keywords} 决定。
 */
public enum TokenType {
    KEYWORD,        // def / print
    IDENTIFIER,     // 单词字符序列，e.g. main
    NUMBER,         // 纯数字序列
    STRING_LITERAL, // 双引号字符串，包含引号本身
    OPERATOR,       // 既不是单词字符也不是空白的字符序列，e.g. ( ) :
    WHITESPACE,     // 空白序列，下游不做特殊处理

    // 预留，当前规则表不会产生
    UNKNOWN
}
