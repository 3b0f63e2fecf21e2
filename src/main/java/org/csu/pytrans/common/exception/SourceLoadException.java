package org.csu.pytrans.common.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 源文件读取或生成文件写入失败。
 */
public class SourceLoadException extends RuntimeException {

    @Getter
    private final Path path;

    public SourceLoadException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public SourceLoadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
