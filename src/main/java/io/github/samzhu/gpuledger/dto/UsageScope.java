package io.github.samzhu.gpuledger.dto;

/**
 * 聚合維度。
 *
 * <p>{@code fileStem} 決定快照檔名 ({@code <stem>_dictionary.csv})，
 * {@code metricSuffix} 決定指標名稱 (例如 {@code day_gpu_<suffix>_hours})。
 */
public enum UsageScope {

    USER("user", "user"),
    GROUP("group", "group"),
    PARTITION("partition", "part");

    private final String fileStem;
    private final String metricSuffix;

    UsageScope(String fileStem, String metricSuffix) {
        this.fileStem = fileStem;
        this.metricSuffix = metricSuffix;
    }

    public String fileStem() {
        return fileStem;
    }

    public String metricSuffix() {
        return metricSuffix;
    }
}
