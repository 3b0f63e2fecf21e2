package org.csu.pytrans.engine;

import lombok.Getter;
import org.csu.pytrans.common.exception.PipelineStateException;
import org.csu.pytrans.compiler.lexer.Token;
import org.csu.pytrans.compiler.parser.SyntaxNode;
import org.csu.pytrans.compiler.semantic.ValidationResult;

import java.nio.file.Path;
import java.util.List;

/**
 * 交互式会话的状态：当前加载的源文件以及各阶段最近一次的产物。
 * 每个方法先检查前置阶段是否已经完成，未完成时抛出 PipelineStateException，
 * 不调用对应阶段，也不改动已有状态。
 * 非线程安全，一个 Shell 持有一个会话。
 */
public class PipelineSession {

    private final TranslationProcessor processor;
    private final SourceLoader sourceLoader;

    @Getter
    private Path sourcePath;
    @Getter
    private String source;
    @Getter
    private List<Token> tokens;
    @Getter
    private SyntaxNode tree;
    @Getter
    private ValidationResult lastValidation;
    @Getter
    private String generatedCode;

    public PipelineSession(TranslationProcessor processor, SourceLoader sourceLoader) {
        this.processor = processor;
        this.sourceLoader = sourceLoader;
    }

    /**
     * 加载新的源文件。成功后丢弃上一个文件派生出的所有结果；失败时会话保持原样。
     */
    public String load(Path path) {
        String text = sourceLoader.loadSource(path);
        this.sourcePath = path;
        this.source = text;
        this.tokens = null;
        this.tree = null;
        this.lastValidation = null;
        this.generatedCode = null;
        return text;
    }

    public List<Token> tokenize() {
        if (source == null) {
            throw new PipelineStateException("Load a file first.");
        }
        this.tokens = processor.tokenize(source);
        this.tree = null;
        this.lastValidation = null;
        this.generatedCode = null;
        return tokens;
    }

    public SyntaxNode parse() {
        if (tokens == null || tokens.isEmpty()) {
            throw new PipelineStateException("Tokenize the code first.");
        }
        this.tree = processor.build(tokens);
        this.lastValidation = null;
        this.generatedCode = null;
        return tree;
    }

    public ValidationResult checkSemantics() {
        requireTree();
        this.lastValidation = processor.validate(tree);
        return lastValidation;
    }

    /**
     * 生成代码不要求先做语义检查。
     */
    public String generate() {
        requireTree();
        this.generatedCode = processor.emit(tree);
        return generatedCode;
    }

    public void save(Path target) {
        ensureGenerated();
        sourceLoader.writeOutput(target, generatedCode);
    }

    public void ensureGenerated() {
        if (generatedCode == null) {
            throw new PipelineStateException("Generate code first.");
        }
    }

    private void requireTree() {
        if (tree == null) {
            throw new PipelineStateException("Parse the code first.");
        }
    }
}
