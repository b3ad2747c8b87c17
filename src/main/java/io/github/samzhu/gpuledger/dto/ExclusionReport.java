package io.github.samzhu.gpuledger.dto;

import java.util.Map;
import java.util.TreeMap;

/**
 * 單次批次的排除統計。
 *
 * <p>GPU 型號不在權重表中的作業會從所有聚合中消失，此報告讓這類流失可被觀察：
 * <ul>
 *   <li>{@code notQualifying} - 非 GPU 或尚未結束的作業 (正常情況)</li>
 *   <li>{@code malformedLines} - 欄位不足或識別碼為空的行</li>
 *   <li>{@code malformedResourceSpecs} - AllocTRES 無法解析的作業</li>
 *   <li>{@code noGpuCount} - 沒有 {@code gres/gpu=<n>} 或數量為 0 的作業</li>
 *   <li>{@code unknownGpuClass} - GPU 型號無對應權重的作業</li>
 *   <li>{@code ambiguousNodeLists} - 節點欄位看起來是多節點清單的已計入作業</li>
 *   <li>{@code accepted} - 已計入聚合的作業</li>
 * </ul>
 *
 * @param notQualifying 未符合過濾條件的行數
 * @param malformedLines 格式錯誤的行數
 * @param malformedResourceSpecs 資源配置錯誤的作業數
 * @param noGpuCount 無 GPU 數量的作業數
 * @param unknownGpuClass 未知 GPU 型號的作業數
 * @param ambiguousNodeLists 多節點清單的作業數
 * @param accepted 已計入的作業數
 * @param unknownClassJobs 各未知型號的作業數 (無型號時 key 為 {@code (none)})
 * @param unknownClassGpuHours 各未知型號未加權的 GPU hours
 */
public record ExclusionReport(
    long notQualifying,
    long malformedLines,
    long malformedResourceSpecs,
    long noGpuCount,
    long unknownGpuClass,
    long ambiguousNodeLists,
    long accepted,
    Map<String, Long> unknownClassJobs,
    Map<String, Double> unknownClassGpuHours
) {
    public static final String NO_CLASS = "(none)";

    public ExclusionReport {
        unknownClassJobs = Map.copyOf(unknownClassJobs);
        unknownClassGpuHours = Map.copyOf(unknownClassGpuHours);
    }

    /**
     * @return 被排除的 GPU 作業總數 (不含未符合過濾條件的行)
     */
    public long excludedJobs() {
        return malformedLines + malformedResourceSpecs + noGpuCount + unknownGpuClass;
    }

    /**
     * 批次執行期間使用的可變計數器。
     */
    public static final class Tally {

        private long notQualifying;
        private long malformedLines;
        private long malformedResourceSpecs;
        private long noGpuCount;
        private long unknownGpuClass;
        private long ambiguousNodeLists;
        private long accepted;
        private final Map<String, Long> unknownClassJobs = new TreeMap<>();
        private final Map<String, Double> unknownClassGpuHours = new TreeMap<>();

        public void notQualifying() {
            notQualifying++;
        }

        public void malformedLine() {
            malformedLines++;
        }

        public void malformedResourceSpec() {
            malformedResourceSpecs++;
        }

        public void noGpuCount() {
            noGpuCount++;
        }

        public void unknownGpuClass(String gpuClass, double gpuHours) {
            unknownGpuClass++;
            String key = gpuClass == null || gpuClass.isBlank() ? NO_CLASS : gpuClass;
            unknownClassJobs.merge(key, 1L, Long::sum);
            unknownClassGpuHours.merge(key, gpuHours, Double::sum);
        }

        public void ambiguousNodeList() {
            ambiguousNodeLists++;
        }

        public void accepted() {
            accepted++;
        }

        public ExclusionReport toReport() {
            return new ExclusionReport(notQualifying, malformedLines, malformedResourceSpecs, noGpuCount,
                unknownGpuClass, ambiguousNodeLists, accepted, unknownClassJobs, unknownClassGpuHours);
        }
    }
}
