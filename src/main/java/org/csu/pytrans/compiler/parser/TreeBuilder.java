package org.csu.pytrans.compiler.parser;

import org.csu.pytrans.compiler.lexer.Token;
import org.csu.pytrans.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * @author hidyouth
 * @description: 语法树构造器
 *
 * 单遍扫描Token流，按关键字分组，得到一棵只有两层的树：
 * 根节点的每个孩子是一个以关键字开头的结构，结构的孩子是该关键字之后、
 * 下一个关键字之前的所有Token（包括空白和运算符）。
 * 第一个关键字之前的Token没有可归属的结构，直接丢弃。
 */
public class TreeBuilder {

    private enum State {
        AWAITING_FIRST_KEYWORD,
        ACCUMULATING_CONSTRUCT
    }

    private final List<Token> tokens;

    public TreeBuilder(List<Token> tokens) {
        this.tokens = tokens == null ? List.of() : tokens;
    }

    public SyntaxNode build() {
        List<SyntaxNode> constructs = new ArrayList<>();
        State state = State.AWAITING_FIRST_KEYWORD;
        Optional<ConstructAccumulator> current = Optional.empty();

        for (Token token : tokens) {
            if (token.is(TokenType.KEYWORD)) {
                if (state == State.ACCUMULATING_CONSTRUCT) {
                    constructs.add(current.orElseThrow().toNode());
                }
                current = Optional.of(new ConstructAccumulator(token.text()));
                state = State.ACCUMULATING_CONSTRUCT;
            } else if (state == State.ACCUMULATING_CONSTRUCT) {
                current.orElseThrow().append(SyntaxNode.leaf(token.text()));
            }
            // AWAITING_FIRST_KEYWORD 状态下的非关键字Token被丢弃
        }

        current.ifPresent(construct -> constructs.add(construct.toNode()));
        return SyntaxNode.root(constructs);
    }

    /**
     * 正在收集孩子的结构节点。
     */
    private static final class ConstructAccumulator {
        private final String keyword;
        private final List<SyntaxNode> children = new ArrayList<>();

        ConstructAccumulator(String keyword) {
            this.keyword = keyword;
        }

        void append(SyntaxNode leaf) {
            children.add(leaf);
        }

        SyntaxNode toNode() {
            return SyntaxNode.of(keyword, children);
        }
    }
}
