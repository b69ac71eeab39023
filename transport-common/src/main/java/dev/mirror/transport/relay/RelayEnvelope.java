package dev.mirror.transport.relay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A network request travelling up the relay chain. It is forwarded unchanged by every hop; only
 * the last hop, which performs the call, normalizes headers and body.
 * @param id correlation id, shared by every hop
 * @param url absolute target URL
 * @param method HTTP method
 * @param headers request headers
 * @param body raw request body, {@code null} for none
 */
public record RelayEnvelope(String id, String url, String method, Map<String, String> headers, byte[] body) {

    public RelayEnvelope {
        method = method == null || method.isBlank() ? "GET" : method.toUpperCase();
        headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
    }

    public RelayEnvelope withId(String newId) {
        return new RelayEnvelope(newId, url, method, headers, body);
    }

    @JsonIgnore
    public int bodyLength() {
        return body == null ? 0 : body.length;
    }

    /**
     * Scheme, host and port of the target, the unit of same-origin comparison.
     */
    public static String originOf(String url) {
        URI uri = URI.create(url);
        if (uri.getScheme() == null || uri.getHost() == null) {
            return "";
        }
        int port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : "http".equalsIgnoreCase(uri.getScheme()) ? 80 : -1;
        }
        return uri.getScheme().toLowerCase() + "://" + uri.getHost().toLowerCase() + ":" + port;
    }
}
