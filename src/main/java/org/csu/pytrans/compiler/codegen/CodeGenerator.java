package org.csu.pytrans.compiler.codegen;

import org.csu.pytrans.compiler.lexer.Keywords;
import org.csu.pytrans.compiler.parser.SyntaxNode;

import java.util.List;

/**
 * @author hidyouth
 * @description: 代码生成器
 *
 * 依次遍历根节点的孩子，每个结构按第一条匹配的规则翻译：
 * def 取第一个孩子作为函数名，print 把所有孩子的文本原样拼接作为输出内容，
 * ":" 翻译成 " {"，其余结构的标签原样输出。
 * 不做转义，也不要求先通过语义检查。
 */
public class CodeGenerator {

    private static final String LINE_BREAK = "\n";

    private final BraceMode braceMode;
    private final TargetDialect dialect;

    public CodeGenerator() {
        this(BraceMode.SINGLE_TRAILING, TargetDialect.GENERIC);
    }

    public CodeGenerator(BraceMode braceMode, TargetDialect dialect) {
        this.braceMode = braceMode;
        this.dialect = dialect;
    }

    public String emit(SyntaxNode tree) {
        StringBuilder code = new StringBuilder();
        boolean functionOpen = false;

        for (SyntaxNode construct : tree.getChildren()) {
            String label = construct.getLabel();
            if (Keywords.DEF.equals(label)) {
                if (braceMode == BraceMode.PER_FUNCTION && functionOpen) {
                    code.append("}").append(LINE_BREAK);
                }
                emitFunctionHeader(construct, code);
                functionOpen = true;
            } else if (Keywords.PRINT.equals(label)) {
                emitPrint(construct, code);
            } else if (Keywords.COLON.equals(label)) {
                code.append(" {").append(LINE_BREAK);
            } else {
                code.append(label);
            }
        }

        if (braceMode == BraceMode.SINGLE_TRAILING || functionOpen) {
            code.append("}").append(LINE_BREAK);
        }
        return code.toString();
    }

    private void emitFunctionHeader(SyntaxNode construct, StringBuilder code) {
        // 第一个孩子按位置约定视为函数名，没有孩子时函数名为空
        List<SyntaxNode> children = construct.getChildren();
        String name = children.isEmpty() ? "" : children.get(0).getLabel();
        code.append("void ").append(name).append("() {").append(LINE_BREAK);
    }

    private void emitPrint(SyntaxNode construct, StringBuilder code) {
        code.append(dialect.stream()).append(" << ");
        for (SyntaxNode argument : construct.getChildren()) {
            code.append(argument.getLabel());
        }
        code.append(" << ").append(dialect.lineTerminator()).append(";").append(LINE_BREAK);
    }
}
