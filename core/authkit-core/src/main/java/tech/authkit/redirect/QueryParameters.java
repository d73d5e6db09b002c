package tech.authkit.redirect;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * URL query helpers for authorization and callback URLs.
 */
public final class QueryParameters {

    private QueryParameters() {
    }

    /**
     * Append parameters to a URL, keeping any query it already has.
     */
    public static String append(String url, Map<String, String> parameters) {
        String query = parameters.entrySet().stream()
            .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
            .collect(Collectors.joining("&"));
        if (query.isEmpty()) {
            return url;
        }

        String separator;
        if (!url.contains("?")) {
            separator = "?";
        } else if (url.endsWith("?") || url.endsWith("&")) {
            separator = "";
        } else {
            separator = "&";
        }
        return url + separator + query;
    }

    /**
     * Parse a raw (still encoded) query string. The first occurrence of a name wins.
     */
    public static Map<String, String> parse(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }

        for (String param : rawQuery.split("&")) {
            if (param.isEmpty()) {
                continue;
            }
            String[] parts = param.split("=", 2);
            String key = urlDecode(parts[0]);
            String value = parts.length == 2 ? urlDecode(parts[1]) : "";
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String urlDecode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
