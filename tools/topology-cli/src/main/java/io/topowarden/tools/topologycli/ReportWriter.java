package io.topowarden.tools.topologycli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.topowarden.anomaly.AnomalyReport;
import io.topowarden.diff.DiffResult;
import io.topowarden.diff.TopologyDiffReport;
import io.topowarden.sync.SyncFailure;
import io.topowarden.sync.SyncResult;
import java.util.Collection;
import java.util.Locale;

/**
 * JSON documents printed by the diff, check and sync commands.
 */
public final class ReportWriter {

    private final ObjectMapper json;

    public ReportWriter(ObjectMapper json) {
        this.json = json;
    }

    public ObjectNode diff(TopologyDiffReport report) {
        ObjectNode document = json.createObjectNode();
        document.put("equal", report.isEmpty());
        document.set("exchanges", diffSection(report.exchanges()));
        document.set("queues", diffSection(report.queues()));
        document.set("bindings", diffSection(report.bindings()));
        return document;
    }

    public ObjectNode check(AnomalyReport report) {
        ObjectNode document = json.createObjectNode();
        document.set("unbound_queues", names(report.unboundQueues()));
        document.set("unbound_exchanges", names(report.unboundExchanges()));
        document.set("no_consumers_no_ttl", names(report.noConsumersNoTtl()));
        document.set("no_consumers_no_dlx", names(report.noConsumersNoDlx()));
        return document;
    }

    public ObjectNode sync(SyncResult result) {
        ObjectNode document = json.createObjectNode();
        document.put("attempted", result.attempted());
        document.put("succeeded", result.succeeded());
        ArrayNode failures = document.putArray("failures");
        for (SyncFailure failure : result.failures()) {
            ObjectNode entry = failures.addObject();
            entry.put("kind", failure.kind().name().toLowerCase(Locale.ROOT));
            entry.put("resource_type", failure.resourceType());
            entry.put("resource", failure.resource());
            entry.put("target", failure.target());
            entry.put("status", failure.httpStatus());
            entry.set("payload", payload(failure.payload()));
        }
        return document;
    }

    public String render(JsonNode document) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize report", e);
        }
    }

    private ObjectNode diffSection(DiffResult<String> result) {
        ObjectNode section = json.createObjectNode();
        section.set("missing", names(result.missing()));
        section.set("extra", names(result.extra()));
        section.set("different", names(result.different()));
        return section;
    }

    private ArrayNode names(Collection<String> names) {
        ArrayNode array = json.createArrayNode();
        names.forEach(array::add);
        return array;
    }

    // broker error bodies are usually JSON objects
    private JsonNode payload(String payload) {
        if (payload.isBlank()) {
            return json.getNodeFactory().textNode("");
        }
        try {
            JsonNode parsed = json.readTree(payload);
            return parsed != null && parsed.isContainerNode() ? parsed : json.getNodeFactory().textNode(payload);
        } catch (JsonProcessingException e) {
            return json.getNodeFactory().textNode(payload);
        }
    }
}
