package com.vtb.parity.chain;

import com.vtb.parity.generation.CaseGenerator;
import com.vtb.parity.models.Chain;
import com.vtb.parity.models.ChainStep;
import com.vtb.parity.models.Operation;
import com.vtb.parity.models.RequestCase;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Построение цепочек обходом графа связей в ширину.
 *
 * Сначала короткие цепочки, среди исходящих переходов первыми идут недавно обнаруженные.
 * Длина цепочки в пределах [2, maxDepth]; одинаковые последовательности operationId
 * допускаются до perSequenceCap раз, всего не больше maxChains.
 * Каждый обход {@link #explore} порождает новые кейсы шагов.
 */
@Slf4j
public class ChainExplorer {

    private final LinkGraph graph;
    private final CaseGenerator generator;

    public ChainExplorer(LinkGraph graph, CaseGenerator generator) {
        this.graph = graph;
        this.generator = generator;
    }

    public Iterable<Chain> explore(int maxDepth, int maxChains, int perSequenceCap) {
        return () -> new ChainIterator(plan(maxDepth, maxChains, perSequenceCap), maxDepth);
    }

    /**
     * Последовательности переходов, которые будут развёрнуты в цепочки.
     * Не зависит от генерации значений, используется и командой graph-chains.
     */
    public List<List<LinkGraph.Edge>> plan(int maxDepth, int maxChains, int perSequenceCap) {
        List<List<LinkGraph.Edge>> plans = new ArrayList<>();
        if (maxDepth < 2 || maxChains <= 0) {
            return plans;
        }
        int cap = Math.max(1, perSequenceCap);
        Map<String, Integer> perSequence = new HashMap<>();

        Deque<Path> queue = new ArrayDeque<>();
        for (String start : graph.startOperations()) {
            queue.add(new Path(start, List.of()));
        }
        while (!queue.isEmpty() && plans.size() < maxChains) {
            Path current = queue.poll();
            List<LinkGraph.Edge> candidates = graph.outgoing(current.last()).stream()
                .sorted(Comparator.comparingInt(LinkGraph.Edge::getIndex).reversed())
                .collect(Collectors.toList());
            for (LinkGraph.Edge edge : candidates) {
                Path next = current.append(edge);
                String key = next.sequenceKey();
                int seen = perSequence.getOrDefault(key, 0);
                while (seen < cap && plans.size() < maxChains) {
                    plans.add(next.edges);
                    seen++;
                }
                perSequence.put(key, seen);
                if (next.length() < maxDepth) {
                    queue.add(next);
                }
                if (plans.size() >= maxChains) {
                    break;
                }
            }
        }
        log.debug("Запланировано цепочек: {}", plans.size());
        return plans;
    }

    public static String sequenceKey(List<LinkGraph.Edge> edges) {
        if (edges.isEmpty()) {
            return "";
        }
        List<String> ids = new ArrayList<>();
        ids.add(edges.get(0).getSourceOperationId());
        edges.forEach(edge -> ids.add(edge.getTargetOperationId()));
        return String.join(" -> ", ids);
    }

    private Chain materialize(List<LinkGraph.Edge> edges, int maxDepth) {
        List<ChainStep> steps = new ArrayList<>();
        Operation first = operation(edges.get(0).getSourceOperationId());
        steps.add(ChainStep.builder()
            .stepIndex(0)
            .template(generator.generateOne(first, Set.of()))
            .build());
        for (LinkGraph.Edge edge : edges) {
            Operation target = operation(edge.getTargetOperationId());
            RequestCase template = generator.generateOne(target, edge.getSuppliedParameters());
            steps.add(ChainStep.builder()
                .stepIndex(steps.size())
                .template(template)
                .linkSource(edge.getLink())
                .build());
        }
        return Chain.builder()
            .chainId(UUID.randomUUID().toString())
            .steps(steps)
            .maxDepth(maxDepth)
            .build();
    }

    private Operation operation(String operationId) {
        return graph.getSpecification().find(operationId)
            .orElseThrow(() -> new IllegalStateException("Операция отсутствует в спецификации: " + operationId));
    }

    private final class ChainIterator implements Iterator<Chain> {
        private final Iterator<List<LinkGraph.Edge>> plans;
        private final int maxDepth;

        ChainIterator(List<List<LinkGraph.Edge>> plans, int maxDepth) {
            this.plans = plans.iterator();
            this.maxDepth = maxDepth;
        }

        @Override
        public boolean hasNext() {
            return plans.hasNext();
        }

        @Override
        public Chain next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return materialize(plans.next(), maxDepth);
        }
    }

    private static final class Path {
        private final String start;
        private final List<LinkGraph.Edge> edges;

        Path(String start, List<LinkGraph.Edge> edges) {
            this.start = start;
            this.edges = edges;
        }

        String last() {
            return edges.isEmpty() ? start : edges.get(edges.size() - 1).getTargetOperationId();
        }

        Path append(LinkGraph.Edge edge) {
            List<LinkGraph.Edge> extended = new ArrayList<>(edges);
            extended.add(edge);
            return new Path(start, List.copyOf(extended));
        }

        int length() {
            return edges.size() + 1;
        }

        String sequenceKey() {
            return ChainExplorer.sequenceKey(edges);
        }
    }
}
