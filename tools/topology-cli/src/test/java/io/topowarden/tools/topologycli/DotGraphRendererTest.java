package io.topowarden.tools.topologycli;

import static org.assertj.core.api.Assertions.assertThat;

import io.topowarden.topology.Binding;
import io.topowarden.topology.DestinationType;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.Queue;
import io.topowarden.topology.Topology;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DotGraphRendererTest {

    private final DotGraphRenderer renderer = new DotGraphRenderer();

    @Test
    void rendersExchangesQueuesBindingsAndDeadLettering() {
        Topology topology = new Topology(
            List.of(new Exchange("orders", "/", "topic", true, false),
                new Exchange("orders.dlx", "/", "fanout", true, false)),
            List.of(new Queue("orders.created", "/", true, false, Map.of("x-dead-letter-exchange", "orders.dlx"))),
            List.of(new Binding("orders", "orders.created", DestinationType.QUEUE, "created", "/")));

        String dot = renderer.render(topology);

        assertThat(dot).startsWith("digraph topology {")
            .contains("\"exchange:/|orders\" [shape=box, label=\"orders\\n(topic)\"];")
            .contains("\"queue:/|orders.created\" [shape=ellipse, label=\"orders.created\"];")
            .contains("\"exchange:/|orders\" -> \"queue:/|orders.created\" [label=\"created\"];")
            .contains("\"queue:/|orders.created\" -> \"exchange:/|orders.dlx\" [label=\"dead-letter\", style=dashed];")
            .endsWith("}\n");
    }

    @Test
    void exchangeDestinationPointsAtExchangeNode() {
        Topology topology = new Topology(
            List.of(new Exchange("orders", "/", "topic", true, false),
                new Exchange("audit", "/", "fanout", true, false)),
            List.of(),
            List.of(new Binding("orders", "audit", DestinationType.EXCHANGE, "#", "/")));

        assertThat(renderer.render(topology)).contains("\"exchange:/|orders\" -> \"exchange:/|audit\" [label=\"#\"];");
    }

    @Test
    void sameNamesInDifferentVhostsAreSeparateNodes() {
        Topology topology = new Topology(
            List.of(new Exchange("orders", "/", "topic", true, false),
                new Exchange("orders", "staging", "topic", true, false)),
            List.of(new Queue("jobs", "/", true, false, Map.of()),
                new Queue("jobs", "staging", true, false, Map.of())),
            List.of(new Binding("orders", "jobs", DestinationType.QUEUE, "job", "staging")));

        String dot = renderer.render(topology);

        assertThat(dot)
            .contains("\"exchange:/|orders\" [shape=box, label=\"orders\\n(topic)\"];")
            .contains("\"exchange:staging|orders\" [shape=box, label=\"orders @ staging\\n(topic)\"];")
            .contains("\"queue:/|jobs\" [shape=ellipse, label=\"jobs\"];")
            .contains("\"queue:staging|jobs\" [shape=ellipse, label=\"jobs @ staging\"];")
            .contains("\"exchange:staging|orders\" -> \"queue:staging|jobs\" [label=\"job\"];")
            .doesNotContain("\"exchange:/|orders\" -> ");
    }

    @Test
    void quotesAndBackslashesAreEscaped() {
        assertThat(DotGraphRenderer.quote("say \"hi\"\\now")).isEqualTo("\"say \\\"hi\\\"\\\\now\"");
    }

    @Test
    void emptyTopologyIsAnEmptyGraph() {
        assertThat(renderer.render(Topology.empty())).isEqualTo("digraph topology {\n  rankdir=LR;\n}\n");
    }
}
