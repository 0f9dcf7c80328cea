package dev.feedlib.fetch;

import java.util.Map;

/**
 * JSON request body sent to the relay: the relay authenticates {@code token}, performs
 * {@code method} on {@code url} with {@code headers}, and answers with the upstream body.
 */
public record ProxyRelayRequest(String token, String method, String url, Map<String, String> headers) {
    public ProxyRelayRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
