package io.github.samzhu.gpuledger.util;

import java.util.ArrayList;
import java.util.List;

import io.github.samzhu.gpuledger.dto.ResourceSpec;
import io.github.samzhu.gpuledger.dto.ResourceSpec.ResourceToken;
import io.github.samzhu.gpuledger.exception.ResourceSpecParseException;

/**
 * 資源配置文字解析工具類。
 *
 * <p>語法：
 * <pre>
 * spec    := token ("," token)*
 * token   := key [":" subkey] "=" value
 * </pre>
 *
 * <p>空白 token (例如連續逗號) 會被略過；空字串解析為沒有任何 token 的配置。
 */
public final class ResourceSpecParser {

    private ResourceSpecParser() {
        // 工具類不允許實例化
    }

    /**
     * 解析資源配置文字。
     *
     * @param text 原始文字，可為 null
     * @return 解析結果
     * @throws ResourceSpecParseException 若 token 缺少 {@code =} 或 key 為空
     */
    public static ResourceSpec parse(String text) {
        if (text == null || text.isBlank()) {
            return new ResourceSpec(text == null ? "" : text, List.of());
        }

        List<ResourceToken> tokens = new ArrayList<>();
        for (String raw : text.split(",")) {
            String token = raw.trim();
            if (token.isEmpty()) {
                continue;
            }
            tokens.add(parseToken(text, token));
        }
        return new ResourceSpec(text, tokens);
    }

    private static ResourceToken parseToken(String text, String token) {
        int equals = token.indexOf('=');
        if (equals < 0) {
            throw new ResourceSpecParseException(text, token, "missing '='");
        }
        String name = token.substring(0, equals).trim();
        String value = token.substring(equals + 1).trim();

        String key = name;
        String subkey = null;
        int colon = name.indexOf(':');
        if (colon >= 0) {
            key = name.substring(0, colon).trim();
            subkey = name.substring(colon + 1).trim();
            if (subkey.isEmpty()) {
                throw new ResourceSpecParseException(text, token, "empty subkey after ':'");
            }
        }
        if (key.isEmpty()) {
            throw new ResourceSpecParseException(text, token, "empty key");
        }
        return new ResourceToken(key, subkey, value, token);
    }
}
