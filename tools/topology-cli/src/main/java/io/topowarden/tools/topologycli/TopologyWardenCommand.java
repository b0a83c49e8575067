package io.topowarden.tools.topologycli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.topowarden.anomaly.AnomalyDetector;
import io.topowarden.anomaly.AnomalyReport;
import io.topowarden.canonical.Canonicalizer;
import io.topowarden.diff.TopologyDiff;
import io.topowarden.diff.TopologyDiffReport;
import io.topowarden.management.BrokerCredentials;
import io.topowarden.management.BrokerTarget;
import io.topowarden.management.BrokerTransportException;
import io.topowarden.sync.SyncEngine;
import io.topowarden.sync.SyncResult;
import io.topowarden.topology.ObservedTopology;
import io.topowarden.topology.StructuralException;
import io.topowarden.topology.Topology;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Topology Warden command-line tool
 *
 * Snapshots, compares, audits and replays RabbitMQ topologies through the management API.
 * Every topology argument is either a snapshot file or a broker address.
 */
@Command(
    name = "topology-warden",
    version = "0.1.0",
    description = "Snapshot, diff, check and replay RabbitMQ broker topologies",
    mixinStandardHelpOptions = true,
    subcommands = {
        TopologyWardenCommand.Dump.class,
        TopologyWardenCommand.Diff.class,
        TopologyWardenCommand.Check.class,
        TopologyWardenCommand.Sync.class,
        TopologyWardenCommand.Graph.class
    },
    footerHeading = "%n@|bold Examples:|@%n",
    footer = {
        "",
        "  Snapshot a broker:",
        "    topology-warden --user admin dump rabbit-a:15672 -o topology.json",
        "",
        "  Compare a snapshot with a live broker:",
        "    topology-warden diff topology.json rabbit-b",
        "",
        "  Replay a snapshot onto another broker:",
        "    topology-warden --password-env RABBIT_B_PASSWORD sync topology.json https://rabbit-b",
        ""
    }
)
public class TopologyWardenCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_DIFFERENT = 1;
    static final int EXIT_VALIDATION = 2;
    static final int EXIT_BROKER = 3;
    static final int EXIT_SYNC_FAILURES = 4;
    static final int EXIT_UNEXPECTED = 5;

    private static final Logger log = LoggerFactory.getLogger(TopologyWardenCommand.class);
    private static final String LOGGER_ROOT = "io.topowarden";

    @Option(
        names = {"-u", "--user"},
        description = "Management API username (default: ${DEFAULT-VALUE})",
        defaultValue = CredentialProvider.DEFAULT_USERNAME
    )
    private String username;

    @Option(
        names = {"-p", "--password"},
        description = "Management API password (prefer --password-env)"
    )
    private String password;

    @Option(
        names = {"--password-env"},
        description = "Environment variable name containing the password (default: ${DEFAULT-VALUE})",
        defaultValue = CredentialProvider.DEFAULT_PASSWORD_ENV
    )
    private String passwordEnv;

    @Option(
        names = {"--connect-timeout"},
        description = "Connect timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "5"
    )
    private long connectTimeoutSeconds;

    @Option(
        names = {"--request-timeout"},
        description = "Request timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "30"
    )
    private long requestTimeoutSeconds;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable debug logging on stderr"
    )
    private boolean verbose;

    @Spec
    private CommandSpec spec;

    private final CredentialProvider credentialProvider;
    private final ObjectMapper json = new ObjectMapper();

    public TopologyWardenCommand() {
        this(new CredentialProvider());
    }

    TopologyWardenCommand(CredentialProvider credentialProvider) {
        this.credentialProvider = credentialProvider;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_VALIDATION;
    }

    int run(CommandSpec command, Callable<Integer> action) {
        PrintWriter err = command.commandLine().getErr();
        try {
            applyVerbosity();
            return action.call();
        } catch (ValidationException e) {
            err.println("✗ Validation error: " + e.getMessage());
            return EXIT_VALIDATION;
        } catch (StructuralException e) {
            err.println("✗ Malformed topology: " + e.getMessage());
            return EXIT_BROKER;
        } catch (BrokerTransportException e) {
            err.println("✗ Broker error: " + e.getMessage());
            return EXIT_BROKER;
        } catch (UncheckedIOException e) {
            err.println("✗ I/O error: " + e.getMessage());
            return EXIT_BROKER;
        } catch (Exception e) {
            log.debug("unexpected failure", e);
            err.println("✗ Unexpected error: " + e.getMessage());
            if (!verbose) {
                err.println("(Use -v for detailed error information)");
            }
            return EXIT_UNEXPECTED;
        } finally {
            err.flush();
        }
    }

    BrokerCredentials credentials() {
        return credentialProvider.resolve(username, password, passwordEnv);
    }

    ManagementClientSettings settings() {
        return ManagementClientSettings.builder()
            .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
            .requestTimeout(Duration.ofSeconds(requestTimeoutSeconds))
            .build();
    }

    HttpBrokerManagementClient managementClient() {
        return new HttpBrokerManagementClient(json, settings());
    }

    TopologySourceLoader sourceLoader(HttpBrokerManagementClient management) {
        return new TopologySourceLoader(
            snapshotStore(),
            new BrokerAddressResolver(settings()),
            management,
            new Canonicalizer());
    }

    ObservedTopology load(String source) {
        return sourceLoader(managementClient()).load(source, credentials());
    }

    SnapshotStore snapshotStore() {
        return new SnapshotStore(json);
    }

    ReportWriter reports() {
        return new ReportWriter(json);
    }

    private void applyVerbosity() {
        if (!verbose) {
            return;
        }
        Logger logger = LoggerFactory.getLogger(LOGGER_ROOT);
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
        }
    }

    @Command(name = "dump", mixinStandardHelpOptions = true,
        description = "Write the canonical topology of a broker or snapshot as snapshot JSON")
    static class Dump implements Callable<Integer> {

        @ParentCommand
        private TopologyWardenCommand parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", paramLabel = "SOURCE", description = "Broker address or snapshot file")
        private String source;

        @Option(names = {"-o", "--output"}, description = "Snapshot file to write (default: stdout)")
        private Path output;

        @Override
        public Integer call() {
            return parent.run(spec, () -> {
                Topology topology = parent.load(source).topology();
                SnapshotStore snapshots = parent.snapshotStore();
                if (output == null) {
                    spec.commandLine().getOut().println(snapshots.render(topology));
                } else {
                    snapshots.write(topology, output);
                    spec.commandLine().getOut().println("✓ Snapshot written: " + output.toAbsolutePath());
                }
                spec.commandLine().getOut().flush();
                return EXIT_OK;
            });
        }
    }

    @Command(name = "diff", mixinStandardHelpOptions = true,
        description = "Compare two topologies; exits 1 when they differ")
    static class Diff implements Callable<Integer> {

        @ParentCommand
        private TopologyWardenCommand parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", paramLabel = "EXPECTED", description = "Broker address or snapshot file")
        private String expected;

        @Parameters(index = "1", paramLabel = "ACTUAL", description = "Broker address or snapshot file")
        private String actual;

        @Override
        public Integer call() {
            return parent.run(spec, () -> {
                Topology left = parent.load(expected).topology();
                Topology right = parent.load(actual).topology();
                TopologyDiffReport report = TopologyDiff.diff(left, right);
                ReportWriter reports = parent.reports();
                spec.commandLine().getOut().println(reports.render(reports.diff(report)));
                spec.commandLine().getOut().flush();
                return report.isEmpty() ? EXIT_OK : EXIT_DIFFERENT;
            });
        }
    }

    @Command(name = "check", mixinStandardHelpOptions = true,
        description = "Report unbound resources and queues that would silently keep messages")
    static class Check implements Callable<Integer> {

        @ParentCommand
        private TopologyWardenCommand parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", paramLabel = "SOURCE", description = "Broker address or snapshot file")
        private String source;

        @Override
        public Integer call() {
            return parent.run(spec, () -> {
                AnomalyReport report = AnomalyDetector.check(parent.load(source));
                if (!report.isClean()) {
                    log.info("topology {} has anomalies", source);
                }
                ReportWriter reports = parent.reports();
                spec.commandLine().getOut().println(reports.render(reports.check(report)));
                spec.commandLine().getOut().flush();
                return EXIT_OK;
            });
        }
    }

    @Command(name = "sync", mixinStandardHelpOptions = true,
        description = "Create every resource of SOURCE on TARGET; exits 4 when the broker rejected any")
    static class Sync implements Callable<Integer> {

        @ParentCommand
        private TopologyWardenCommand parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", paramLabel = "SOURCE", description = "Broker address or snapshot file")
        private String source;

        @Parameters(index = "1", paramLabel = "TARGET", description = "Broker address to create resources on")
        private String targetAddress;

        @Override
        public Integer call() {
            return parent.run(spec, () -> {
                HttpBrokerManagementClient management = parent.managementClient();
                TopologySourceLoader loader = parent.sourceLoader(management);
                BrokerCredentials credentials = parent.credentials();
                Topology topology = loader.load(source, credentials).topology();
                BrokerTarget target = loader.resolveBroker(targetAddress, credentials);
                SyncResult result = new SyncEngine(management).sync(topology, target);
                ReportWriter reports = parent.reports();
                spec.commandLine().getOut().println(reports.render(reports.sync(result)));
                spec.commandLine().getOut().flush();
                return result.isFullySynced() ? EXIT_OK : EXIT_SYNC_FAILURES;
            });
        }
    }

    @Command(name = "graph", mixinStandardHelpOptions = true,
        description = "Render a topology as a Graphviz DOT digraph")
    static class Graph implements Callable<Integer> {

        @ParentCommand
        private TopologyWardenCommand parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", paramLabel = "SOURCE", description = "Broker address or snapshot file")
        private String source;

        @Override
        public Integer call() {
            return parent.run(spec, () -> {
                Topology topology = parent.load(source).topology();
                spec.commandLine().getOut().print(new DotGraphRenderer().render(topology));
                spec.commandLine().getOut().flush();
                return EXIT_OK;
            });
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TopologyWardenCommand())
            .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
            .execute(args);
        System.exit(exitCode);
    }
}
