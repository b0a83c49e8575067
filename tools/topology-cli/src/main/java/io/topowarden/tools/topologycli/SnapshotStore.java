package io.topowarden.tools.topologycli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.topowarden.topology.StructuralException;
import io.topowarden.topology.Topology;
import io.topowarden.topology.TopologyRecords;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes topology snapshot files. Snapshots are trusted to be canonical already and are
 * only decoded, never cleaned.
 */
public final class SnapshotStore {

    private final ObjectMapper json;

    public SnapshotStore(ObjectMapper json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    public Topology read(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read snapshot " + path, e);
        }
        JsonNode document;
        try {
            document = json.readTree(content);
        } catch (JsonProcessingException e) {
            throw new StructuralException("snapshot " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        try {
            return TopologyRecords.topology(document);
        } catch (StructuralException e) {
            throw new StructuralException("snapshot " + path + ": " + e.getMessage(), e);
        }
    }

    public void write(Topology topology, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, render(topology) + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write snapshot " + path, e);
        }
    }

    public String render(Topology topology) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(TopologyRecords.toJson(topology));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize topology", e);
        }
    }
}
