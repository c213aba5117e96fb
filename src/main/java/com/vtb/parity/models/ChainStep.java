package com.vtb.parity.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Шаг цепочки: шаблон запроса и link, через который шаг получает данные предыдущего.
 * Для первого шага {@code linkSource == null}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ChainStep {
    int stepIndex;
    RequestCase template;
    LinkSpec linkSource;
}
