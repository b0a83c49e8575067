package io.topowarden.tools.topologycli;

import io.topowarden.canonical.Canonicalizer;
import io.topowarden.canonical.RawTopology;
import io.topowarden.management.BrokerCredentials;
import io.topowarden.management.BrokerManagementPort;
import io.topowarden.management.BrokerTarget;
import io.topowarden.topology.ObservedTopology;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a topology from a command-line source argument: an existing file is read as a snapshot,
 * anything else is treated as a broker address and queried live.
 */
public final class TopologySourceLoader {

    private static final Logger log = LoggerFactory.getLogger(TopologySourceLoader.class);

    private final SnapshotStore snapshots;
    private final BrokerAddressResolver resolver;
    private final BrokerManagementPort management;
    private final Canonicalizer canonicalizer;

    public TopologySourceLoader(SnapshotStore snapshots,
                                BrokerAddressResolver resolver,
                                BrokerManagementPort management,
                                Canonicalizer canonicalizer) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.management = Objects.requireNonNull(management, "management");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer");
    }

    public ObservedTopology load(String source, BrokerCredentials credentials) {
        if (isSnapshot(source)) {
            log.debug("loading snapshot {}", source);
            return ObservedTopology.withoutRuntimeData(snapshots.read(Path.of(source)));
        }
        BrokerTarget target = resolveBroker(source, credentials);
        log.debug("querying broker {}", target);
        RawTopology raw = management.fetchTopology(target);
        return canonicalizer.canonicalize(raw);
    }

    public BrokerTarget resolveBroker(String address, BrokerCredentials credentials) {
        return new BrokerTarget(resolver.resolve(address), credentials);
    }

    static boolean isSnapshot(String source) {
        if (source == null || source.isBlank()) {
            throw new ValidationException("Topology source must not be blank");
        }
        try {
            return Files.isRegularFile(Path.of(source));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
