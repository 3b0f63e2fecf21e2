package org.csu.pytrans.compiler.codegen;

/**
 * 生成代码时如何输出右花括号。
 */
public enum BraceMode {

    /**
     * 不论打开了几个函数，末尾只输出一个 "}"。默认模式。
     */
    SINGLE_TRAILING("single"),

    /**
     * 每个 def 打开的函数体都有自己的 "}"：遇到下一个 def 前先关闭上一个，
     * 最后一个函数在末尾关闭；没有 def 时不输出花括号。
     */
    PER_FUNCTION("per-function");

    private final String flagValue;

    BraceMode(String flagValue) {
        this.flagValue = flagValue;
    }

    public static BraceMode fromFlag(String value) {
        for (BraceMode mode : values()) {
            if (mode.flagValue.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown brace mode: '" + value + "' (expected single or per-function)");
    }
}
