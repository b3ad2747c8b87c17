package io.github.samzhu.gpuledger.dto;

import java.util.List;

import io.github.samzhu.gpuledger.exception.ResourceSpecParseException;

/**
 * 解析後的資源配置 (Slurm AllocTRES)。
 *
 * <p>原始文字為逗號分隔的 {@code key[:subkey]=value} 序列，例如：
 * <pre>
 * billing=8,cpu=8,gres/gpu:nvidia_h100_80gb_hbm3=2,gres/gpu=2,mem=64G,node=1
 * </pre>
 *
 * @param source 原始文字
 * @param tokens 依出現順序排列的 token
 * @see io.github.samzhu.gpuledger.util.ResourceSpecParser
 */
public record ResourceSpec(
    String source,
    List<ResourceToken> tokens
) {
    public static final String GPU_KEY = "gres/gpu";

    public ResourceSpec {
        tokens = List.copyOf(tokens);
    }

    /**
     * 取得 GPU 數量，來自不帶型號的 {@code gres/gpu=<n>} token。
     *
     * <p>若出現多次，以第一個為準。
     *
     * @return GPU 數量，找不到時為 0
     * @throws ResourceSpecParseException 若數量不是非負整數
     */
    public int gpuCount() {
        for (ResourceToken token : tokens) {
            if (GPU_KEY.equals(token.key()) && token.subkey() == null) {
                return parseCount(token);
            }
        }
        return 0;
    }

    /**
     * 取得所有 {@code gres/gpu:<class>=...} token 的 GPU 型號，依出現順序。
     *
     * @return GPU 型號清單，可能為空
     */
    public List<String> gpuClasses() {
        return tokens.stream()
            .filter(token -> GPU_KEY.equals(token.key()) && token.subkey() != null)
            .map(ResourceToken::subkey)
            .toList();
    }

    private int parseCount(ResourceToken token) {
        String value = token.value();
        if (value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
            throw new ResourceSpecParseException(source, token.raw(), "GPU count is not a non-negative integer");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ResourceSpecParseException(source, token.raw(), "GPU count is out of range");
        }
    }

    /**
     * 單一資源 token。
     *
     * @param key 資源名稱，例如 {@code gres/gpu}
     * @param subkey 子類別 (冒號後的部分)，例如 GPU 型號；沒有時為 null
     * @param value 等號後的值
     * @param raw 原始 token 文字
     */
    public record ResourceToken(
        String key,
        String subkey,
        String value,
        String raw
    ) {
    }
}
