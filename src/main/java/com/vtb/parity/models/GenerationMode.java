package com.vtb.parity.models;

/**
 * Режим генерации кейсов
 */
public enum GenerationMode {
    /** Каждый кейс валиден по схемам операции */
    POSITIVE,
    /** Допускаются значения, нарушающие схему (для негативных проверок) */
    EXPLORATORY
}
