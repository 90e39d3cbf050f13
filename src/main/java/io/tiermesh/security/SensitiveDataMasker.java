package io.tiermesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tiermesh.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scrubs audit details before they hit disk: credential-looking keys, opaque token
 * values and userinfo embedded in endpoint URLs.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern URL_USERINFO = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*://)[^/@\\s]+@(.*)$");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        return masked(input, null);
    }

    private static JsonNode masked(JsonNode input, String parentKey) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(entry.getValue(), key));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value, parentKey));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (URL_USERINFO.matcher(text).matches()) {
                return Jsons.mapper().getNodeFactory().textNode(URL_USERINFO.matcher(text).replaceFirst("$1" + MASK + "@$2"));
            }
            if (!isIdentifierKey(parentKey) && likelySecretValue(text)) {
                return Jsons.mapper().getNodeFactory().textNode(MASK);
            }
        }
        return input;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    // Record ids, job ids and checksums are long opaque strings too, but they are what an auditor searches for.
    private static boolean isIdentifierKey(String rawKey) {
        if (rawKey == null) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        return key.endsWith("id") || key.endsWith("ids") || key.contains("checksum");
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        return OPAQUE_TOKEN.matcher(value.trim()).matches();
    }
}
