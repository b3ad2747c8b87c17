package io.github.samzhu.gpuledger.exception;

/**
 * 作業執行時間 (Elapsed) 格式錯誤。
 *
 * <p>代表上游 {@code sacct} 輸出格式已改變，不可靜默忽略：
 * <ul>
 *   <li>整個批次中止，不寫入任何快照</li>
 *   <li>程式以非零狀態結束，交由排程系統告警</li>
 * </ul>
 */
public class MalformedElapsedTimeException extends RuntimeException {

    private final String value;
    private final long lineNumber;

    public MalformedElapsedTimeException(String value, String reason) {
        super(String.format("Malformed elapsed time '%s': %s", value, reason));
        this.value = value;
        this.lineNumber = -1;
    }

    public MalformedElapsedTimeException(long lineNumber, MalformedElapsedTimeException cause) {
        super(String.format("Line %d: %s", lineNumber, cause.getMessage()), cause);
        this.value = cause.getValue();
        this.lineNumber = lineNumber;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return 發生錯誤的行號 (從 1 開始)，未知時為 -1
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
