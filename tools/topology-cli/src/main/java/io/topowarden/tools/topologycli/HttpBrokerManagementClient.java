package io.topowarden.tools.topologycli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.topowarden.canonical.RawTopology;
import io.topowarden.management.BrokerManagementPort;
import io.topowarden.management.BrokerTarget;
import io.topowarden.management.BrokerTransportException;
import io.topowarden.management.MutationResult;
import io.topowarden.topology.Binding;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.Queue;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerManagementPort} over the RabbitMQ management HTTP API.
 * <p>
 * Create calls map {@code 201} to created and {@code 204} to already-exists; any other status is
 * returned as a failed mutation carrying the response body. I/O failures are thrown as
 * {@link BrokerTransportException}.
 */
public final class HttpBrokerManagementClient implements BrokerManagementPort {

    private static final Logger log = LoggerFactory.getLogger(HttpBrokerManagementClient.class);

    private final HttpClient http;
    private final ObjectMapper json;
    private final Duration requestTimeout;

    public HttpBrokerManagementClient(ObjectMapper json, ManagementClientSettings settings) {
        this(HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .build(),
            json,
            settings);
    }

    HttpBrokerManagementClient(HttpClient http, ObjectMapper json, ManagementClientSettings settings) {
        this.http = Objects.requireNonNull(http, "http");
        this.json = Objects.requireNonNull(json, "json");
        this.requestTimeout = settings.requestTimeout();
    }

    @Override
    public RawTopology fetchTopology(BrokerTarget target) {
        return new RawTopology(
            fetchArray(target, "exchanges"),
            fetchArray(target, "queues"),
            fetchArray(target, "bindings"));
    }

    @Override
    public MutationResult createExchange(BrokerTarget target, Exchange exchange) {
        ObjectNode body = json.createObjectNode();
        body.put("type", exchange.type());
        body.put("durable", exchange.durable());
        body.put("auto_delete", exchange.autoDelete());
        body.put("internal", exchange.internal());
        body.set("arguments", json.valueToTree(exchange.arguments()));
        return mutate(target, "PUT", "exchanges/" + encode(exchange.vhost()) + "/" + encode(exchange.name()), body);
    }

    @Override
    public MutationResult createQueue(BrokerTarget target, Queue queue) {
        ObjectNode body = json.createObjectNode();
        body.put("durable", queue.durable());
        body.put("auto_delete", queue.autoDelete());
        body.set("arguments", json.valueToTree(queue.arguments()));
        return mutate(target, "PUT", "queues/" + encode(queue.vhost()) + "/" + encode(queue.name()), body);
    }

    @Override
    public MutationResult createBinding(BrokerTarget target, Binding binding) {
        if (!binding.targetsQueue()) {
            throw new IllegalArgumentException("only exchange-to-queue bindings can be created, got " + binding);
        }
        ObjectNode body = json.createObjectNode();
        body.put("routing_key", binding.routingKey());
        body.set("arguments", json.valueToTree(binding.arguments()));
        String path = "bindings/" + encode(binding.vhost())
            + "/e/" + encode(binding.source())
            + "/q/" + encode(binding.destination());
        return mutate(target, "POST", path, body);
    }

    private List<JsonNode> fetchArray(BrokerTarget target, String resource) {
        URI uri = apiUri(target, resource);
        HttpRequest request = authorized(target, HttpRequest.newBuilder(uri))
            .header("Accept", "application/json")
            .GET()
            .build();
        HttpResponse<String> response = send(request);
        log.debug("GET {} status {} length {}", uri.getRawPath(), response.statusCode(), bodyLength(response));
        if (response.statusCode() != 200) {
            throw new BrokerTransportException(
                "GET " + uri + " returned status " + response.statusCode() + ": " + response.body());
        }
        JsonNode array;
        try {
            array = json.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new BrokerTransportException("GET " + uri + " returned malformed JSON", e);
        }
        if (array == null || !array.isArray()) {
            throw new BrokerTransportException("GET " + uri + " did not return a JSON array");
        }
        List<JsonNode> records = new ArrayList<>(array.size());
        array.forEach(records::add);
        return records;
    }

    private MutationResult mutate(BrokerTarget target, String method, String path, ObjectNode body) {
        URI uri = apiUri(target, path);
        String requestTarget = method + " " + uri.getRawPath();
        HttpRequest request = authorized(target, HttpRequest.newBuilder(uri))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(body.toString()))
            .build();
        HttpResponse<String> response = send(request);
        int status = response.statusCode();
        log.debug("{} status {}", requestTarget, status);
        if (status == 204) {
            return MutationResult.alreadyExists(requestTarget, status);
        }
        if (status >= 200 && status < 300) {
            return MutationResult.created(requestTarget, status);
        }
        return MutationResult.failed(requestTarget, status, response.body());
    }

    private HttpRequest.Builder authorized(BrokerTarget target, HttpRequest.Builder builder) {
        String credentials = target.credentials().username() + ":" + target.credentials().password();
        String token = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        return builder
            .timeout(requestTimeout)
            .header("Authorization", "Basic " + token);
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new BrokerTransportException(
                request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerTransportException("interrupted during " + request.method() + " " + request.uri(), e);
        }
    }

    private static URI apiUri(BrokerTarget target, String relativePath) {
        String base = target.managementUri().toString();
        return URI.create(base.endsWith("/") ? base + relativePath : base + "/" + relativePath);
    }

    static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static int bodyLength(HttpResponse<String> response) {
        return response.body() != null ? response.body().length() : 0;
    }
}
