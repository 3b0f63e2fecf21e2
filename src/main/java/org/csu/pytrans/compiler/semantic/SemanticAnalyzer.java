package org.csu.pytrans.compiler.semantic;

import org.csu.pytrans.common.exception.SemanticException;
import org.csu.pytrans.compiler.lexer.Keywords;
import org.csu.pytrans.compiler.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语义分析器
 * 只检查一条规则：print 结构的第一个参数必须是字符串常量。
 * 分析器不会修改语法树。
 */
public class SemanticAnalyzer {

    public static final String PRINT_REQUIRES_STRING = "print construct requires a string argument";

    /**
     * 检查所有 print 结构。结果中的下标是第一个出错的结构，原因里列出所有出错的结构。
     */
    public ValidationResult validate(SyntaxNode tree) {
        List<SyntaxNode> constructs = tree.getChildren();
        List<String> violations = new ArrayList<>();
        int firstViolation = -1;
        for (int i = 0; i < constructs.size(); i++) {
            SyntaxNode construct = constructs.get(i);
            if (!Keywords.PRINT.equals(construct.getLabel())) {
                continue;
            }
            String detail = checkPrint(construct);
            if (detail == null) {
                continue;
            }
            if (firstViolation < 0) {
                firstViolation = i;
            }
            violations.add(String.format("construct #%d '%s': %s", i + 1, Keywords.PRINT, detail));
        }
        if (violations.isEmpty()) {
            return ValidationResult.success();
        }
        return ValidationResult.failure(firstViolation,
                PRINT_REQUIRES_STRING + " (" + String.join("; ", violations) + ")");
    }

    // 返回 null 表示通过
    private String checkPrint(SyntaxNode construct) {
        List<SyntaxNode> arguments = construct.getChildren();
        if (arguments.isEmpty()) {
            return "no argument";
        }
        String first = arguments.get(0).getLabel();
        return first.startsWith("\"") ? null : "found '" + first + "'";
    }

    /**
     * 与 {@link #validate(SyntaxNode)} 相同的检查，失败时抛出异常。
     */
    public void analyze(SyntaxNode tree) {
        ValidationResult result = validate(tree);
        if (!result.passed()) {
            throw new SemanticException(result.reason());
        }
    }
}
