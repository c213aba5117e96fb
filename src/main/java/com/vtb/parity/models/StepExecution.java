package com.vtb.parity.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Выполненный шаг против одной цели: фактически отправленный запрос и полученный результат
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StepExecution {
    int stepIndex;
    RequestCase request;
    StepResult result;
    /** Шаг отправлен с неразрешёнными link-параметрами */
    boolean degraded;
}
