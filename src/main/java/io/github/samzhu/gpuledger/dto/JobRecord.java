package io.github.samzhu.gpuledger.dto;

/**
 * 單一已結束作業的帳務紀錄。
 *
 * <p>由 {@link io.github.samzhu.gpuledger.service.AccountingRecordParser} 從 {@code sacct}
 * 輸出的一行建立，處理完即丟棄。欄位對應 (以 {@code |} 分隔，從 0 起算)：
 * <ul>
 *   <li>{@code userId} - 欄位 2</li>
 *   <li>{@code groupId} - 欄位 3 的第一個逗號分隔值</li>
 *   <li>{@code partitionId} - 欄位 4 的第一個逗號分隔值</li>
 *   <li>{@code elapsedWall} - 欄位 5，格式 {@code [D-]HH:MM:SS}</li>
 *   <li>{@code resourceSpec} - 欄位 6，AllocTRES 原始文字</li>
 *   <li>{@code nodeName} - 欄位 7，僅用於分區重新歸類</li>
 * </ul>
 *
 * <p>GPU 數量與 GPU 型號權重為衍生值，不存放於此。
 */
public record JobRecord(
    String userId,
    String groupId,
    String partitionId,
    String elapsedWall,
    String resourceSpec,
    String nodeName
) {
}
