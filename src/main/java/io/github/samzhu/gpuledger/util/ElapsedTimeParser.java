package io.github.samzhu.gpuledger.util;

import io.github.samzhu.gpuledger.exception.MalformedElapsedTimeException;

/**
 * 作業執行時間轉換工具類。
 *
 * <p>將 {@code sacct} 的 Elapsed 欄位 ({@code [D-]HH:MM:SS}) 轉換為小時數：
 * <pre>
 * hours = days × 24 + HH + MM / 60 + SS / 3600
 * </pre>
 *
 * <p>不做範圍檢查 (例如 MM 可以超過 59)，但每個欄位都必須是非負整數，
 * 且時間部分必須剛好三段。
 */
public final class ElapsedTimeParser {

    private ElapsedTimeParser() {
        // 工具類不允許實例化
    }

    /**
     * 轉換執行時間為小時數。
     *
     * @param elapsed 執行時間文字，例如 {@code 1-02:03:04} 或 {@code 02:03:04}
     * @return 小時數
     * @throws MalformedElapsedTimeException 若格式不符
     */
    public static double toHours(String elapsed) {
        if (elapsed == null || elapsed.isBlank()) {
            throw new MalformedElapsedTimeException(elapsed, "value is empty");
        }
        String text = elapsed.trim();

        long days = 0;
        String clock = text;
        int dash = text.indexOf('-');
        if (dash >= 0) {
            days = parseComponent(elapsed, text.substring(0, dash), "days");
            clock = text.substring(dash + 1);
        }

        String[] parts = clock.split(":", -1);
        if (parts.length != 3) {
            throw new MalformedElapsedTimeException(elapsed,
                "expected HH:MM:SS but found " + parts.length + " component(s)");
        }

        long hours = parseComponent(elapsed, parts[0], "hours");
        long minutes = parseComponent(elapsed, parts[1], "minutes");
        long seconds = parseComponent(elapsed, parts[2], "seconds");

        return days * 24 + hours + minutes / 60.0 + seconds / 3600.0;
    }

    private static long parseComponent(String elapsed, String component, String name) {
        if (component.isEmpty() || !component.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new MalformedElapsedTimeException(elapsed, name + " component '" + component + "' is not an integer");
        }
        try {
            return Long.parseLong(component);
        } catch (NumberFormatException e) {
            throw new MalformedElapsedTimeException(elapsed, name + " component '" + component + "' is out of range");
        }
    }
}
