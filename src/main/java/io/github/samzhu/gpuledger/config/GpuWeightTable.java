package io.github.samzhu.gpuledger.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import io.github.samzhu.gpuledger.dto.ResourceSpec;

/**
 * GPU 型號計費權重表。
 *
 * <p>將不同世代 GPU 的 GPU hours 正規化為可比較的計費單位 (gpu_tres_hours)。
 * 啟動時由 {@link GpuLedgerProperties#gpuWeights()} 建立，之後唯讀。
 *
 * <p>型號比對 (不分大小寫)：
 * <ol>
 *   <li>完全比對，例如 {@code h100}</li>
 *   <li>包含比對，依權重表順序，例如 {@code nvidia_h100_80gb_hbm3} → {@code h100}</li>
 * </ol>
 */
public final class GpuWeightTable {

    private final Map<String, Double> weights;

    /**
     * @param weights GPU 型號 → 權重，權重必須為正數
     * @throws IllegalArgumentException 若型號為空或權重不為正數
     */
    public GpuWeightTable(Map<String, ? extends Number> weights) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        weights.forEach((gpuClass, weight) -> {
            if (gpuClass == null || gpuClass.isBlank()) {
                throw new IllegalArgumentException("GPU class name must not be blank");
            }
            if (weight == null || !(weight.doubleValue() > 0)) {
                throw new IllegalArgumentException("GPU weight must be positive: " + gpuClass + "=" + weight);
            }
            normalized.put(gpuClass.trim().toLowerCase(Locale.ROOT), weight.doubleValue());
        });
        this.weights = Collections.unmodifiableMap(normalized);
    }

    /**
     * 查詢單一 GPU 型號的權重。
     *
     * @param gpuClass GPU 型號
     * @return 權重，找不到時為 empty
     */
    public OptionalDouble lookup(String gpuClass) {
        if (gpuClass == null || gpuClass.isBlank()) {
            return OptionalDouble.empty();
        }
        String normalized = gpuClass.trim().toLowerCase(Locale.ROOT);

        Double exact = weights.get(normalized);
        if (exact != null) {
            return OptionalDouble.of(exact);
        }
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (normalized.contains(entry.getKey())) {
                return OptionalDouble.of(entry.getValue());
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * 取得資源配置的 GPU 型號權重。
     *
     * <p>若有多個 {@code gres/gpu:<class>} token，以最後一個能比對到的為準。
     *
     * @param spec 資源配置
     * @return 權重，沒有任何型號比對成功時為 0
     */
    public double weightOf(ResourceSpec spec) {
        double weight = 0.0;
        for (String gpuClass : spec.gpuClasses()) {
            OptionalDouble match = lookup(gpuClass);
            if (match.isPresent()) {
                weight = match.getAsDouble();
            }
        }
        return weight;
    }

    public Set<String> classes() {
        return weights.keySet();
    }

    @Override
    public String toString() {
        return "GpuWeightTable" + weights;
    }
}
