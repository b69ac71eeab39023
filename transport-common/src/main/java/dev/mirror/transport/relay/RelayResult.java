package dev.mirror.transport.relay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response coming back down the relay chain.
 * @param url final URL, after redirects when the network hop followed any
 * @param method method of the originating request
 * @param statusCode HTTP status
 * @param statusMessage reason phrase, may be empty
 * @param headers response headers, lower-case names
 * @param body response body as ordered chunks
 */
public record RelayResult(String url, String method, int statusCode, String statusMessage,
                          Map<String, String> headers, List<byte[]> body) {

    public RelayResult {
        headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
        body = body == null ? List.of() : new ArrayList<>(body);
        statusMessage = statusMessage == null ? "" : statusMessage;
    }

    @JsonIgnore
    public boolean ok() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Concatenates the body chunks into one buffer.
     */
    public byte[] bodyBytes() {
        if (body.size() == 1) {
            return body.get(0).clone();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] chunk : body) {
            out.writeBytes(chunk);
        }
        return out.toByteArray();
    }
}
