package org.csu.pytrans.engine;

import lombok.Getter;
import org.csu.pytrans.common.exception.SemanticException;
import org.csu.pytrans.compiler.codegen.CodeGenerator;
import org.csu.pytrans.compiler.lexer.Lexer;
import org.csu.pytrans.compiler.lexer.Token;
import org.csu.pytrans.compiler.parser.SyntaxNode;
import org.csu.pytrans.compiler.parser.TreeBuilder;
import org.csu.pytrans.compiler.semantic.SemanticAnalyzer;
import org.csu.pytrans.compiler.semantic.ValidationResult;

import java.util.List;

/**
 * 翻译流水线的入口：词法分析 -> 构造语法树 -> 语义检查 -> 代码生成。
 * 各阶段都是纯函数，这个类本身也不保存任何跨调用的状态，可以被多个线程共用。
 */
public class TranslationProcessor {

    @Getter
    private final TranslatorOptions options;
    private final SemanticAnalyzer semanticAnalyzer;
    private final CodeGenerator codeGenerator;

    public TranslationProcessor() {
        this(TranslatorOptions.defaults());
    }

    public TranslationProcessor(TranslatorOptions options) {
        this.options = options;
        this.semanticAnalyzer = new SemanticAnalyzer();
        this.codeGenerator = new CodeGenerator(options.braceMode(), options.dialect());
    }

    public List<Token> tokenize(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        log("Lexer produced " + tokens.size() + " tokens.");
        return tokens;
    }

    public SyntaxNode build(List<Token> tokens) {
        SyntaxNode tree = new TreeBuilder(tokens).build();
        log("Tree builder produced " + tree.getChildren().size() + " constructs.");
        return tree;
    }

    public ValidationResult validate(SyntaxNode tree) {
        ValidationResult result = semanticAnalyzer.validate(tree);
        log(result.passed() ? "Semantic check passed." : "Semantic check failed: " + result.reason());
        return result;
    }

    /**
     * 与 {@link #validate(SyntaxNode)} 相同，但失败时抛出 SemanticException。
     */
    public void analyze(SyntaxNode tree) {
        try {
            semanticAnalyzer.analyze(tree);
        } catch (SemanticException e) {
            log("Semantic check failed: " + e.getMessage());
            throw e;
        }
        log("Semantic check passed.");
    }

    public String emit(SyntaxNode tree) {
        String code = codeGenerator.emit(tree);
        log("Code generator produced " + code.length() + " characters.");
        return code;
    }

    /**
     * 一次跑完所有阶段。语义检查失败不会阻止代码生成。
     */
    public TranslationResult translate(String source) {
        List<Token> tokens = tokenize(source);
        SyntaxNode tree = build(tokens);
        ValidationResult validation = validate(tree);
        String code = emit(tree);
        return new TranslationResult(tokens, tree, validation, code);
    }

    private void log(String message) {
        if (options.verbose()) {
            System.out.println("[Translator] " + message);
        }
    }
}
