package com.vtb.parity.models;

/**
 * Итог повторного выполнения бандла
 */
public enum ReplayClassification {
    /** Расхождений больше нет */
    FIXED,
    /** Расходятся те же пути */
    PERSISTENT,
    /** Расхождение появилось на другом пути */
    DIFFERENT,
    /** Повтор не удалось выполнить (цель недоступна и т.п.) */
    ERROR
}
