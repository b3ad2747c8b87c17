package io.github.samzhu.gpuledger.dto;

/**
 * GPU 用量累加值。
 *
 * <p>三個數值皆為非負，且同一 key 合併越多作業只會增加：
 * <ul>
 *   <li>{@code elapsedHours} - 作業執行小時數總和 (未乘 GPU 數)</li>
 *   <li>{@code gpuHours} - Σ (執行小時 × GPU 數)</li>
 *   <li>{@code weightedGpuHours} - Σ (GPU hours × GPU 型號權重)，即 gpu_tres_hours</li>
 * </ul>
 *
 * @param elapsedHours 執行小時數
 * @param gpuHours GPU hours
 * @param weightedGpuHours 加權 GPU hours
 */
public record UsageTriple(
    double elapsedHours,
    double gpuHours,
    double weightedGpuHours
) {
    public static final UsageTriple ZERO = new UsageTriple(0.0, 0.0, 0.0);

    public UsageTriple {
        requireNonNegative("elapsedHours", elapsedHours);
        requireNonNegative("gpuHours", gpuHours);
        requireNonNegative("weightedGpuHours", weightedGpuHours);
    }

    /**
     * 逐欄相加。
     *
     * @param other 另一個用量
     * @return 相加後的新用量
     */
    public UsageTriple plus(UsageTriple other) {
        return new UsageTriple(
            elapsedHours + other.elapsedHours,
            gpuHours + other.gpuHours,
            weightedGpuHours + other.weightedGpuHours);
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
    }
}
