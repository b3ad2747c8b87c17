package io.github.samzhu.gpuledger.exception;

/**
 * 保留池節點清單查詢失敗。
 *
 * <p>處理方式：保留池視為空集合，分區重新歸類退化為「永不屬於保留池」，
 * 並以 WARN 記錄，因為這會改變分區統計的語意。
 */
public class NodeLookupException extends RuntimeException {

    public NodeLookupException(String message) {
        super(message);
    }

    public NodeLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
