package io.topowarden.tools.topologycli;

import io.topowarden.topology.Binding;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.Queue;
import io.topowarden.topology.Topology;
import io.topowarden.topology.TopologyKeys;

/**
 * Renders a topology as a Graphviz digraph. Exchanges are boxes and queues are ellipses, each
 * identified by vhost and name. Bindings are labelled with their routing key; dead-letter wiring
 * is drawn dashed.
 */
public final class DotGraphRenderer {

    public String render(Topology topology) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph topology {\n");
        dot.append("  rankdir=LR;\n");
        for (Exchange exchange : topology.exchanges()) {
            dot.append("  ").append(exchangeNode(exchange.vhost(), exchange.name()))
                .append(" [shape=box, label=")
                .append(quote(exchange.name() + vhostSuffix(exchange.vhost()) + "\n(" + exchange.type() + ")"))
                .append("];\n");
        }
        for (Queue queue : topology.queues()) {
            dot.append("  ").append(queueNode(queue.vhost(), queue.name()))
                .append(" [shape=ellipse, label=").append(quote(queue.name() + vhostSuffix(queue.vhost())))
                .append("];\n");
        }
        for (Binding binding : topology.bindings()) {
            String destination = binding.targetsQueue()
                ? queueNode(binding.vhost(), binding.destination())
                : exchangeNode(binding.vhost(), binding.destination());
            dot.append("  ").append(exchangeNode(binding.vhost(), binding.source()))
                .append(" -> ").append(destination)
                .append(" [label=").append(quote(binding.routingKey()))
                .append("];\n");
        }
        for (Queue queue : topology.queues()) {
            queue.deadLetterExchange().ifPresent(dlx -> dot.append("  ").append(queueNode(queue.vhost(), queue.name()))
                .append(" -> ").append(exchangeNode(queue.vhost(), dlx))
                .append(" [label=\"dead-letter\", style=dashed];\n"));
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String exchangeNode(String vhost, String name) {
        return quote("exchange:" + TopologyKeys.vhostScoped(vhost, name));
    }

    private static String queueNode(String vhost, String name) {
        return quote("queue:" + TopologyKeys.vhostScoped(vhost, name));
    }

    private static String vhostSuffix(String vhost) {
        return Topology.DEFAULT_VHOST.equals(vhost) ? "" : " @ " + vhost;
    }

    static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }
}
