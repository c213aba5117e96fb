package com.vtb.parity.models;

/**
 * Вид терминальной ошибки транспорта при обращении к цели
 */
public enum TransportErrorKind {
    TIMEOUT,
    CONNECTION_FAILURE,
    TRANSPORT
}
