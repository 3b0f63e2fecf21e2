package org.csu.pytrans.common.exception;

/**
 * 某个阶段在其输入准备好之前被调用。
 * 阶段本身不会执行，会话状态保持不变。
 */
public class PipelineStateException extends RuntimeException {
    public PipelineStateException(String message) {
        super(message);
    }
}
