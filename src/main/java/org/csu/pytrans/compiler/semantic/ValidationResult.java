package org.csu.pytrans.compiler.semantic;

/**
 * 语义检查的结论。
 *
 * @param passed         是否通过
 * @param reason         失败原因，列出所有出错的结构；通过时为 null
 * @param constructIndex 第一个出错结构在根节点孩子中的下标，通过时为 -1
 */
public record ValidationResult(boolean passed, String reason, int constructIndex) {

    private static final ValidationResult PASSED = new ValidationResult(true, null, -1);

    public static ValidationResult success() {
        return PASSED;
    }

    public static ValidationResult failure(int constructIndex, String reason) {
        return new ValidationResult(false, reason, constructIndex);
    }
}
