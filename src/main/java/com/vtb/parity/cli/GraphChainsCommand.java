package com.vtb.parity.cli;

import com.vtb.parity.chain.ChainExplorer;
import com.vtb.parity.chain.LinkGraph;
import com.vtb.parity.config.ParityConfig;
import com.vtb.parity.core.SpecificationModel;
import com.vtb.parity.generation.CaseGenerator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "graph-chains",
    mixinStandardHelpOptions = true,
    description = "Показать граф links и последовательности операций, которые explore выполнит как цепочки"
)
public class GraphChainsCommand implements Callable<Integer> {

    @Mixin
    private SpecOptions specOptions;

    @Option(names = {"-c", "--config"}, description = "YAML с настройками")
    private Path configPath;

    @Option(names = {"--max-depth"}, description = "Максимальная длина цепочки")
    private Integer maxDepth;

    @Option(names = {"--max-chains"}, description = "Максимум цепочек")
    private Integer maxChains;

    @Override
    public Integer call() {
        ParityConfig config = ParityConfig.load(configPath);
        SpecificationModel specification = specOptions.loadSpecification();
        LinkGraph graph = LinkGraph.build(specification);

        System.out.println("Переходы (" + graph.getEdges().size() + "):");
        graph.describe().forEach(line -> System.out.println("  " + line));
        System.out.println("Стартовые операции: " + graph.startOperations());

        ParityConfig.Chains chains = config.getChains();
        int depth = maxDepth != null ? maxDepth : chains.getMaxDepth();
        int limit = maxChains != null ? maxChains : chains.getMaxChains();
        ChainExplorer explorer = new ChainExplorer(graph,
            new CaseGenerator(config.getGeneration().getSeed(), config.getGeneration().getMode()));
        List<List<LinkGraph.Edge>> plans = explorer.plan(depth, limit, chains.getPerSequenceCap());

        System.out.println();
        System.out.println("Цепочки (" + plans.size() + ", глубина <= " + depth + "):");
        plans.forEach(plan -> System.out.println("  " + ChainExplorer.sequenceKey(plan)));
        return MainCommand.EXIT_OK;
    }
}
