package org.csu.pytrans.compiler.parser;

import java.util.List;
import java.util.Objects;

/**
 * 语法树节点。
 * 根节点只是一个容器，标签为空串；其余节点的标签一定非空，
 * 可能是关键字（结构节点），也可能是普通 Token 的文本（叶子节点）。
 */
public final class SyntaxNode {

    private static final String ROOT_LABEL = "";

    private final String label;
    private final List<SyntaxNode> children;

    private SyntaxNode(String label, List<SyntaxNode> children) {
        this.label = label;
        this.children = List.copyOf(children);
    }

    public static SyntaxNode root(List<SyntaxNode> constructs) {
        return new SyntaxNode(ROOT_LABEL, constructs);
    }

    public static SyntaxNode of(String label, List<SyntaxNode> children) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("Only the root node may have an empty label");
        }
        return new SyntaxNode(label, children);
    }

    public static SyntaxNode leaf(String label) {
        return of(label, List.of());
    }

    public String getLabel() {
        return label;
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return label.isEmpty();
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return "SyntaxNode[" + label + "]";
        }
        return "SyntaxNode[" + label + ", children=" + children + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyntaxNode that = (SyntaxNode) o;
        return label.equals(that.label) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, children);
    }
}
