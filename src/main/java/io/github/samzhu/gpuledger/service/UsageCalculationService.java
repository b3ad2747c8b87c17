package io.github.samzhu.gpuledger.service;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gpuledger.config.GpuWeightTable;
import io.github.samzhu.gpuledger.dto.ResourceSpec;
import io.github.samzhu.gpuledger.dto.UsageTriple;

/**
 * GPU 加權用量計算服務。
 *
 * <p>計算公式：
 * <pre>
 * elapsed_hours      = h
 * gpu_hours          = h × gpu_count
 * weighted_gpu_hours = gpu_hours × weight
 * </pre>
 *
 * <p>只有 {@code gpu_count > 0} 且 {@code weight > 0} 的作業會產生用量；
 * 否則該作業不計入任何維度。
 *
 * @see GpuWeightTable
 */
@Service
public class UsageCalculationService {

    private static final Logger log = LoggerFactory.getLogger(UsageCalculationService.class);

    private final GpuWeightTable weightTable;

    public UsageCalculationService(GpuWeightTable weightTable) {
        this.weightTable = weightTable;
        log.info("UsageCalculationService initialized with {} GPU classes", weightTable.classes().size());
    }

    /**
     * 計算單一作業的用量。
     *
     * @param elapsedHours 執行小時數
     * @param gpuCount GPU 數量
     * @param weight GPU 型號權重
     * @return 用量；GPU 數量或權重不為正數時為 empty
     */
    public Optional<UsageTriple> calculate(double elapsedHours, int gpuCount, double weight) {
        if (gpuCount <= 0 || !(weight > 0)) {
            return Optional.empty();
        }
        double gpuHours = elapsedHours * gpuCount;
        return Optional.of(new UsageTriple(elapsedHours, gpuHours, gpuHours * weight));
    }

    /**
     * 以權重表計算單一作業的用量。
     *
     * @param elapsedHours 執行小時數
     * @param spec 已解析的資源配置
     * @return 用量；無 GPU 數量或型號無對應權重時為 empty
     */
    public Optional<UsageTriple> calculate(double elapsedHours, ResourceSpec spec) {
        return calculate(elapsedHours, spec.gpuCount(), weightTable.weightOf(spec));
    }

    /**
     * @param spec 已解析的資源配置
     * @return 權重，無對應型號時為 0
     */
    public double weightOf(ResourceSpec spec) {
        return weightTable.weightOf(spec);
    }
}
