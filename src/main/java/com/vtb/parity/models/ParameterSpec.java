package com.vtb.parity.models;

import io.swagger.v3.oas.models.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Параметр операции из спецификации (path/query/header/cookie)
 */
@Value
@Builder
public class ParameterSpec {
    String name;
    ParameterLocation location;
    boolean required;
    Schema<?> schema;
}
