package io.github.samzhu.gpuledger.repository;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import io.github.samzhu.gpuledger.dto.UsageTriple;
import io.github.samzhu.gpuledger.exception.SnapshotFormatException;

/**
 * 快照檔案單行的編碼與解碼。
 *
 * <p>格式 (數值保留一位小數)：
 * <pre>
 * name=alice , gpu_hours=12.5 , gpu_tres_hours=2613.8 , total_hours=6.3
 * name=alice , gpu_hours=12.5 , gpu_tres_hours=2613.8 , total_hours=6.3 , index=4
 * </pre>
 *
 * <p>解碼時也接受舊格式 {@code name= alice , gpu_hours= 12.5, gpu_tres_hours= 2613.8}：
 * 等號後可有空白，{@code total_hours} 缺少時為 0，{@code index} 缺少時為 null。
 */
final class SnapshotLineCodec {

    private static final String NAME = "name";
    private static final String GPU_HOURS = "gpu_hours";
    private static final String GPU_TRES_HOURS = "gpu_tres_hours";
    private static final String TOTAL_HOURS = "total_hours";
    private static final String INDEX = "index";

    private SnapshotLineCodec() {
        // 工具類不允許實例化
    }

    static String encode(String name, UsageTriple usage) {
        return String.format(Locale.ROOT, "%s=%s , %s=%.1f , %s=%.1f , %s=%.1f",
            NAME, name,
            GPU_HOURS, usage.gpuHours(),
            GPU_TRES_HOURS, usage.weightedGpuHours(),
            TOTAL_HOURS, usage.elapsedHours());
    }

    static String encode(String name, UsageTriple usage, int index) {
        return encode(name, usage) + " , " + INDEX + "=" + index;
    }

    /**
     * 解碼單行。
     *
     * @param file 來源檔案 (錯誤訊息用)
     * @param line 單行內容
     * @return 解碼結果
     * @throws SnapshotFormatException 若缺少必要欄位或數值錯誤
     */
    static SnapshotLine decode(Path file, String line) {
        Map<String, String> fields = new HashMap<>();
        for (String part : line.split(",")) {
            String field = part.trim();
            if (field.isEmpty()) {
                continue;
            }
            int equals = field.indexOf('=');
            if (equals < 0) {
                throw new SnapshotFormatException(file, line, "field '" + field + "' has no '='");
            }
            fields.put(field.substring(0, equals).trim(), field.substring(equals + 1).trim());
        }

        String name = fields.get(NAME);
        if (name == null || name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new SnapshotFormatException(file, line, "missing or invalid name");
        }
        double gpuHours = parseHours(file, line, fields, GPU_HOURS, true);
        double weightedHours = parseHours(file, line, fields, GPU_TRES_HOURS, true);
        double elapsedHours = parseHours(file, line, fields, TOTAL_HOURS, false);

        Integer index = null;
        String indexText = fields.get(INDEX);
        if (indexText != null) {
            try {
                index = Integer.valueOf(indexText);
            } catch (NumberFormatException e) {
                throw new SnapshotFormatException(file, line, "index is not an integer");
            }
            if (index < 1) {
                throw new SnapshotFormatException(file, line, "index must be positive");
            }
        }

        try {
            return new SnapshotLine(name, new UsageTriple(elapsedHours, gpuHours, weightedHours), index);
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException(file, line, e.getMessage());
        }
    }

    private static double parseHours(Path file, String line, Map<String, String> fields, String key, boolean required) {
        String value = fields.get(key);
        if (value == null) {
            if (required) {
                throw new SnapshotFormatException(file, line, "missing " + key);
            }
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new SnapshotFormatException(file, line, key + " is not a number");
        }
    }

    /**
     * 解碼後的單行。
     *
     * @param name 實體名稱
     * @param usage 用量
     * @param index index，日用量檔或舊格式檔案為 null
     */
    record SnapshotLine(
        String name,
        UsageTriple usage,
        Integer index
    ) {
    }
}
