package org.csu.pytrans.engine;

import org.csu.pytrans.compiler.codegen.BraceMode;
import org.csu.pytrans.compiler.codegen.TargetDialect;

/**
 * 翻译器的可选项。没有配置文件，默认值就在这里，命令行参数可以覆盖。
 *
 * @param braceMode 右花括号的输出方式
 * @param dialect   print 语句的目标写法
 * @param verbose   是否打印每个阶段的摘要
 */
public record TranslatorOptions(BraceMode braceMode, TargetDialect dialect, boolean verbose) {

    public static TranslatorOptions defaults() {
        return new TranslatorOptions(BraceMode.SINGLE_TRAILING, TargetDialect.GENERIC, false);
    }

    /**
     * 应用一个形如 --name=value 的命令行参数。
     * @throws IllegalArgumentException 参数名或取值不认识
     */
    public TranslatorOptions withFlag(String flag) {
        if ("--verbose".equals(flag)) {
            return new TranslatorOptions(braceMode, dialect, true);
        }
        int eq = flag.indexOf('=');
        if (!flag.startsWith("--") || eq < 0) {
            throw new IllegalArgumentException("Unknown option: " + flag);
        }
        String name = flag.substring(2, eq);
        String value = flag.substring(eq + 1);
        switch (name) {
            case "brace-mode":
                return new TranslatorOptions(BraceMode.fromFlag(value), dialect, verbose);
            case "dialect":
                return new TranslatorOptions(braceMode, TargetDialect.fromFlag(value), verbose);
            default:
                throw new IllegalArgumentException("Unknown option: " + flag);
        }
    }
}
