package com.vtb.parity.chain;

import com.vtb.parity.core.SpecificationModel;
import com.vtb.parity.models.LinkSpec;
import com.vtb.parity.models.Operation;
import com.vtb.parity.models.ParameterSpec;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Граф переходов между операциями, построенный один раз из объявленных links.
 *
 * Ребро X → Y есть, если link операции X называет хотя бы один параметр Y.
 * Индекс ребра: порядок обнаружения, по нему обход предпочитает недавние переходы.
 */
@Slf4j
public class LinkGraph {

    @Value
    public static class Edge {
        int index;
        String sourceOperationId;
        String targetOperationId;
        LinkSpec link;
        /** Параметры приёмника, которые даёт link (имена без префикса) */
        Set<String> suppliedParameters;
    }

    private final SpecificationModel specification;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, Set<String>> linkSupplied;

    private LinkGraph(SpecificationModel specification, List<Edge> edges) {
        this.specification = specification;
        this.edges = List.copyOf(edges);
        Map<String, List<Edge>> out = new LinkedHashMap<>();
        Map<String, Set<String>> supplied = new LinkedHashMap<>();
        for (Edge edge : edges) {
            out.computeIfAbsent(edge.getSourceOperationId(), k -> new ArrayList<>()).add(edge);
            supplied.computeIfAbsent(edge.getTargetOperationId(), k -> new LinkedHashSet<>())
                .addAll(edge.getSuppliedParameters());
        }
        this.outgoing = out;
        this.linkSupplied = supplied;
    }

    public static LinkGraph build(SpecificationModel specification) {
        List<Edge> edges = new ArrayList<>();
        for (Operation source : specification.getOperations()) {
            for (LinkSpec link : source.getLinks()) {
                Operation target = specification.find(link.getTargetOperationId()).orElse(null);
                if (target == null) {
                    continue;
                }
                Set<String> supplied = new LinkedHashSet<>();
                for (String key : link.getParameters().keySet()) {
                    String name = LinkSpec.bareParameterName(key);
                    if (target.findParameter(name).isPresent()) {
                        supplied.add(name);
                    } else {
                        log.debug("Link {} ({}): параметр '{}' не объявлен в {}",
                            link.getName(), source.getOperationId(), key, target.getOperationId());
                    }
                }
                if (supplied.isEmpty()) {
                    log.warn("Link {} из {} не называет ни одного параметра {}, переход не учитывается",
                        link.getName(), source.getOperationId(), target.getOperationId());
                    continue;
                }
                edges.add(new Edge(edges.size(), source.getOperationId(), target.getOperationId(),
                    link, Collections.unmodifiableSet(supplied)));
            }
        }
        log.info("Граф связей: {} переходов", edges.size());
        return new LinkGraph(specification, edges);
    }

    public SpecificationModel getSpecification() {
        return specification;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public List<Edge> outgoing(String operationId) {
        return outgoing.getOrDefault(operationId, List.of());
    }

    /**
     * Все параметры операции, которые может дать какой-либо входящий link
     */
    public Set<String> linkSuppliedParameters(String operationId) {
        return linkSupplied.getOrDefault(operationId, Set.of());
    }

    /**
     * Операции, с которых может начинаться цепочка: у них нет обязательных параметров,
     * получаемых только через link. Если таких нет (граф из одних циклов), стартуют
     * все операции с исходящими переходами.
     */
    public List<String> startOperations() {
        List<String> starts = new ArrayList<>();
        for (Operation operation : specification.getOperations()) {
            Set<String> supplied = linkSuppliedParameters(operation.getOperationId());
            boolean needsLink = operation.getParameters().stream()
                .filter(ParameterSpec::isRequired)
                .anyMatch(parameter -> supplied.contains(parameter.getName()));
            if (!needsLink && !outgoing(operation.getOperationId()).isEmpty()) {
                starts.add(operation.getOperationId());
            }
        }
        if (starts.isEmpty()) {
            starts.addAll(outgoing.keySet());
        }
        return starts;
    }

    /**
     * Текстовое представление для команды graph-chains
     */
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        for (Edge edge : edges) {
            lines.add(edge.getSourceOperationId() + " --[" + edge.getLink().getName()
                + " " + edge.getLink().getStatusCode() + ": " + String.join(", ", edge.getSuppliedParameters())
                + "]--> " + edge.getTargetOperationId());
        }
        return lines;
    }
}
