package io.github.samzhu.gpuledger.exception;

import java.nio.file.Path;

/**
 * 快照檔案內容格式錯誤。
 *
 * <p>快照是跨執行保存的唯一狀態，格式錯誤時中止合併，
 * 避免以錯誤的累計值覆寫快照。
 */
public class SnapshotFormatException extends RuntimeException {

    private final Path file;
    private final String line;

    public SnapshotFormatException(Path file, String line, String reason) {
        super(String.format("Snapshot line format is incorrect: %s, file='%s', line='%s'", reason, file, line));
        this.file = file;
        this.line = line;
    }

    public Path getFile() {
        return file;
    }

    public String getLine() {
        return line;
    }
}
