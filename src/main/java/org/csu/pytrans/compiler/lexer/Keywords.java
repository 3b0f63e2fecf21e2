package org.csu.pytrans.compiler.lexer;

import java.util.List;

/**
 * 源语言中有特殊含义的词。
 */
public final class Keywords {

    public static final String DEF = "def";
    public static final String PRINT = "print";

    // 块起始标记，代码生成时翻译成花括号
    public static final String COLON = ":";

    public static final List<String> RESERVED_WORDS = List.of(DEF, PRINT);

    private Keywords() {
    }
}
