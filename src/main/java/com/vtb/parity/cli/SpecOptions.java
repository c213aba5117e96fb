package com.vtb.parity.cli;

import com.vtb.parity.core.OpenAPIParser;
import com.vtb.parity.core.SpecificationModel;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class SpecOptions {

    @Option(
        names = {"-s", "--spec"},
        required = true,
        description = "Путь к файлу OpenAPI спецификации (YAML/JSON) или URL"
    )
    String specificationPath;

    @Option(
        names = {"--exclude"},
        split = ",",
        description = "operationId, исключаемые из прогона (через запятую)"
    )
    List<String> excluded = new ArrayList<>();

    SpecificationModel loadSpecification() {
        OpenAPIParser parser = new OpenAPIParser();
        parser.parse(specificationPath);
        SpecificationModel model = parser.buildModel();
        for (String operationId : excluded) {
            if (model.find(operationId).isEmpty()) {
                log.warn("--exclude: операция {} отсутствует в спецификации", operationId);
            }
        }
        return model.without(excluded);
    }
}
