package io.github.samzhu.gpuledger.service;

import java.util.Set;

/**
 * 分區重新歸類規則。
 *
 * <p>保留池節點也會被共用分區 (例如 requeue) 使用。為避免重複計算：
 * <ul>
 *   <li>節點屬於保留池、但分區名稱不屬於保留池 → 歸類為 {@code nonReservedLabel}</li>
 *   <li>其他情況 → 維持原分區名稱</li>
 * </ul>
 *
 * <p>節點欄位以整串比對，不展開多節點清單 (例如 {@code holygpu8a[11101-11102]})。
 * 跨保留池與非保留池節點的多節點作業如何歸類尚未定案。
 *
 * <p>每次批次由 {@link ReservedPoolService#loadReclassifier()} 建立，執行期間不變。
 */
public final class PartitionReclassifier {

    private final Set<String> reservedNodes;
    private final String partitionMarker;
    private final String nonReservedLabel;

    public PartitionReclassifier(Set<String> reservedNodes, String partitionMarker, String nonReservedLabel) {
        this.reservedNodes = Set.copyOf(reservedNodes);
        this.partitionMarker = partitionMarker;
        this.nonReservedLabel = nonReservedLabel;
    }

    /**
     * 取得作業的歸類分區。
     *
     * @param nodeName 作業的節點欄位
     * @param partitionId 作業回報的分區
     * @return 歸類後的分區名稱
     */
    public String reclassify(String nodeName, String partitionId) {
        if (reservedNodes.contains(nodeName) && !denotesReservedPool(partitionId)) {
            return nonReservedLabel;
        }
        return partitionId;
    }

    /**
     * @return 分區名稱是否屬於保留池
     */
    public boolean denotesReservedPool(String label) {
        return label != null && label.contains(partitionMarker);
    }

    /**
     * 判斷歸類後的分區是否納入分區維度統計。
     *
     * @param label 歸類後的分區名稱
     * @return 保留池分區或非保留池歸類名稱時為 true
     */
    public boolean isRetained(String label) {
        return denotesReservedPool(label) || nonReservedLabel.equals(label);
    }

    /**
     * @return 節點欄位是否看起來是多節點清單
     */
    public static boolean looksLikeNodeList(String nodeName) {
        return nodeName != null && (nodeName.indexOf('[') >= 0 || nodeName.indexOf(',') >= 0);
    }

    public int reservedNodeCount() {
        return reservedNodes.size();
    }
}
