package org.csu.pytrans.engine;

import org.csu.pytrans.common.exception.SourceLoadException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 读取源文件、写出生成的代码。文本一律按 UTF-8 处理。
 */
public class SourceLoader {

    public String loadSource(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new SourceLoadException(path, "File not found: " + path.toAbsolutePath());
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceLoadException(path, "Unable to read file: " + path.toAbsolutePath() + " (" + e.getMessage() + ")", e);
        }
    }

    public void writeOutput(Path path, String content) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceLoadException(path, "Unable to write file: " + path.toAbsolutePath() + " (" + e.getMessage() + ")", e);
        }
    }
}
