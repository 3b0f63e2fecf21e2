package org.csu.pytrans.cli.tool;

import org.csu.pytrans.compiler.parser.SyntaxNode;

/**
 * 把语法树格式化为缩进文本：每层缩进两个空格，每行一个标签。
 */
public class TreeFormatter {

    private static final int INDENT = 2;
    private static final String ROOT_DISPLAY = "<root>";

    public static String format(SyntaxNode tree) {
        StringBuilder sb = new StringBuilder();
        append(tree, 0, sb);
        return sb.toString();
    }

    private static void append(SyntaxNode node, int depth, StringBuilder sb) {
        String label = node.isRoot() ? ROOT_DISPLAY : TokenFormatter.visible(node.getLabel());
        sb.append(" ".repeat(depth)).append(label).append("\n");
        for (SyntaxNode child : node.getChildren()) {
            append(child, depth + INDENT, sb);
        }
    }
}
