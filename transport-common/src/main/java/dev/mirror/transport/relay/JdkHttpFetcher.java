package dev.mirror.transport.relay;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link NetworkFetcher} on top of the JDK HTTP client. Headers the client manages itself are
 * dropped from the outgoing request, multi-valued response headers are joined with {@code ", "}.
 */
public class JdkHttpFetcher implements NetworkFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpFetcher.class);

    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade", "keep-alive", "transfer-encoding");

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpFetcher(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(), requestTimeout);
    }

    public JdkHttpFetcher(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public RelayResult fetch(RelayEnvelope envelope) throws IOException {
        HttpRequest.BodyPublisher publisher = envelope.bodyLength() == 0
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(envelope.body());
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(envelope.url()))
            .timeout(requestTimeout)
            .method(envelope.method(), publisher);
        envelope.headers().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT)) && value != null) {
                builder.header(name, value);
            }
        });
        LOGGER.debug("Fetching {} {} ({} bytes body)", envelope.method(), envelope.url(), envelope.bodyLength());
        try {
            HttpResponse<byte[]> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            return new RelayResult(
                response.uri().toString(),
                envelope.method(),
                response.statusCode(),
                reasonPhrase(response.statusCode()),
                flatten(response.headers()),
                List.of(response.body() == null ? new byte[0] : response.body()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching " + envelope.url());
        }
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        headers.map().forEach((name, values) -> flat.put(name.toLowerCase(Locale.ROOT), String.join(", ", values)));
        return flat;
    }

    static String reasonPhrase(int status) {
        return switch (status) {
            case 200 -> "OK";
            case 201 -> "Created";
            case 204 -> "No Content";
            case 301 -> "Moved Permanently";
            case 302 -> "Found";
            case 304 -> "Not Modified";
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            default -> "";
        };
    }
}
