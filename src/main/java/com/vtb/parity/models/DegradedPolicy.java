package com.vtb.parity.models;

/**
 * Что делать со следующим шагом цепочки, если link не дал значение параметра
 */
public enum DegradedPolicy {
    /** Отправить шаг с исходными значениями генератора, пометив его degraded */
    EXECUTE,
    /** Остановить цепочку перед шагом (truncated) */
    SKIP
}
