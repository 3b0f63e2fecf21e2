package org.csu.pytrans.compiler.codegen;

/**
 * 目标代码中 print 语句使用的输出流和换行符名称。
 */
public enum TargetDialect {
    GENERIC("generic", "output", "newline"),
    CPP("cpp", "std::cout", "std::endl");

    private final String flagValue;
    private final String stream;
    private final String lineTerminator;

    TargetDialect(String flagValue, String stream, String lineTerminator) {
        this.flagValue = flagValue;
        this.stream = stream;
        this.lineTerminator = lineTerminator;
    }

    public String stream() {
        return stream;
    }

    public String lineTerminator() {
        return lineTerminator;
    }

    public static TargetDialect fromFlag(String value) {
        for (TargetDialect dialect : values()) {
            if (dialect.flagValue.equalsIgnoreCase(value)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown dialect: '" + value + "' (expected generic or cpp)");
    }
}
