package com.vtb.parity.cli;

import com.vtb.parity.core.SpecificationModel;
import com.vtb.parity.models.LinkSpec;
import com.vtb.parity.models.Operation;
import com.vtb.parity.models.ParameterSpec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
    name = "list-operations",
    mixinStandardHelpOptions = true,
    description = "Показать операции спецификации, их параметры и links"
)
public class ListOperationsCommand implements Callable<Integer> {

    @Mixin
    private SpecOptions specOptions;

    @Override
    public Integer call() {
        SpecificationModel specification = specOptions.loadSpecification();
        System.out.println(specification.getTitle() + " " + specification.getVersion()
            + ", операций: " + specification.getOperations().size());
        for (Operation operation : specification.getOperations()) {
            System.out.printf("%n%s  %s %s%n", operation.getOperationId(), operation.getMethod(), operation.getPathTemplate());
            if (!operation.getParameters().isEmpty()) {
                System.out.println("    параметры: " + operation.getParameters().stream()
                    .map(ListOperationsCommand::describe)
                    .collect(Collectors.joining(", ")));
            }
            operation.preferredMediaType().ifPresent(type -> System.out.println("    тело: " + type
                + (operation.isBodyRequired() ? " (обязательно)" : "")));
            for (LinkSpec link : operation.getLinks()) {
                System.out.println("    link " + link.getName() + " [" + link.getStatusCode() + "] -> "
                    + link.getTargetOperationId() + " " + link.getParameters());
            }
        }
        return MainCommand.EXIT_OK;
    }

    private static String describe(ParameterSpec parameter) {
        return parameter.getName() + " (" + parameter.getLocation().name().toLowerCase()
            + (parameter.isRequired() ? ", required" : "") + ")";
    }
}
