package io.github.samzhu.gpuledger.exception;

/**
 * 資源配置 (AllocTRES) 格式錯誤。
 *
 * <p>處理方式：該作業視為無法計費，不計入任何聚合，並計入排除統計。
 * 不會中止整個批次。
 */
public class ResourceSpecParseException extends RuntimeException {

    private final String resourceSpec;
    private final String token;

    public ResourceSpecParseException(String resourceSpec, String token, String reason) {
        super(String.format("Malformed resource spec: %s, token='%s', spec='%s'", reason, token, resourceSpec));
        this.resourceSpec = resourceSpec;
        this.token = token;
    }

    public String getResourceSpec() {
        return resourceSpec;
    }

    public String getToken() {
        return token;
    }
}
