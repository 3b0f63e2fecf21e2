package org.csu.pytrans.engine;

import org.csu.pytrans.compiler.lexer.Token;
import org.csu.pytrans.compiler.parser.SyntaxNode;
import org.csu.pytrans.compiler.semantic.ValidationResult;

import java.util.List;

/**
 * 一次完整翻译的所有阶段产物。
 */
public record TranslationResult(
        List<Token> tokens,          // 词法分析结果
        SyntaxNode tree,             // 语法树
        ValidationResult validation, // 语义检查结论，仅供参考
        String code                  // 生成的目标代码，即使语义检查失败也会生成
) {
    public TranslationResult {
        tokens = List.copyOf(tokens);
    }

    public boolean isValid() {
        return validation.passed();
    }
}
