package io.topowarden.tools.topologycli;

import io.topowarden.management.BrokerTransportException;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@code host[:port]} address (or a full URL) into the management API base URI.
 * <p>
 * The address is probed once; redirects (typically HTTP to HTTPS) are followed by hand so the
 * scheme, host and port that finally answer are the ones used for every later call.
 */
public final class BrokerAddressResolver {

    public static final int DEFAULT_PORT = 15672;
    static final String API_PATH = "/api/";

    private static final Logger log = LoggerFactory.getLogger(BrokerAddressResolver.class);

    private final HttpClient http;
    private final Duration requestTimeout;
    private final int maxRedirects;

    public BrokerAddressResolver(ManagementClientSettings settings) {
        this(HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(),
            settings);
    }

    BrokerAddressResolver(HttpClient http, ManagementClientSettings settings) {
        this.http = Objects.requireNonNull(http, "http");
        this.requestTimeout = settings.requestTimeout();
        this.maxRedirects = settings.maxRedirects();
    }

    public URI resolve(String address) {
        URI probe = initialUri(address);
        for (int hop = 0; hop <= maxRedirects; hop++) {
            HttpResponse<Void> response = send(probe);
            Optional<String> location = response.headers().firstValue("Location");
            if (!isRedirect(response.statusCode()) || location.isEmpty()) {
                URI api = apiUri(probe);
                log.debug("resolved broker address {} to {}", address, api);
                return api;
            }
            URI next = probe.resolve(location.get());
            log.info("broker address {} redirected ({}) to {}", probe, response.statusCode(), next);
            probe = rootOf(next);
        }
        throw new BrokerTransportException(
            "broker address " + address + " redirected more than " + maxRedirects + " times");
    }

    static URI initialUri(String address) {
        if (address == null || address.isBlank()) {
            throw new ValidationException("Broker address must not be blank");
        }
        String trimmed = address.trim();
        String withScheme = trimmed.contains("://") ? trimmed : "http://" + trimmed;
        URI parsed;
        try {
            parsed = new URI(withScheme);
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid broker address: " + address, e);
        }
        if (parsed.getHost() == null) {
            throw new ValidationException("Broker address has no host: " + address);
        }
        String scheme = parsed.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ValidationException("Unsupported broker address scheme: " + scheme);
        }
        int port = parsed.getPort() == -1 && !trimmed.contains("://") ? DEFAULT_PORT : parsed.getPort();
        return rootOf(buildUri(scheme, parsed.getHost(), port, "/"));
    }

    private HttpResponse<Void> send(URI probe) {
        HttpRequest request = HttpRequest.newBuilder(probe)
            .timeout(requestTimeout)
            .GET()
            .build();
        try {
            return http.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new BrokerTransportException("cannot reach broker at " + probe + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerTransportException("interrupted while probing " + probe, e);
        }
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static URI rootOf(URI uri) {
        return buildUri(uri.getScheme(), uri.getHost(), uri.getPort(), "/");
    }

    private static URI apiUri(URI root) {
        return buildUri(root.getScheme(), root.getHost(), root.getPort(), API_PATH);
    }

    private static URI buildUri(String scheme, String host, int port, String path) {
        try {
            return new URI(scheme, null, host, port, path, null, null);
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid broker address " + scheme + "://" + host + ":" + port, e);
        }
    }
}
