package com.vtb.parity.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * Правило сравнения одного поля (пути JSON, заголовка или статуса).
 *
 * Задаётся либо {@code predefined} (встроенная стратегия или шаблон из библиотеки выражений
 * с параметрами), либо {@code expr}: произвольное выражение над {@code a} и {@code b}.
 * Правило только с {@code presence} проверяет наличие без сравнения значений.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldRule {
    private PresenceMode presence = PresenceMode.PARITY;
    private String predefined;
    private String expr;
    private Double tolerance;
    private Double seconds;
    private Double millis;
    private Integer length;
    private String pattern;
    private String substring;
    private Double min;
    private Double max;

    public static FieldRule predefined(String name) {
        FieldRule rule = new FieldRule();
        rule.setPredefined(name);
        return rule;
    }

    public static FieldRule expression(String expr) {
        FieldRule rule = new FieldRule();
        rule.setExpr(expr);
        return rule;
    }

    @JsonIgnore
    public boolean hasComparison() {
        return predefined != null || expr != null;
    }

    /**
     * Имя правила для отчёта о расхождении
     */
    @JsonIgnore
    public String ruleName() {
        if (predefined != null) {
            return predefined;
        }
        return expr != null ? "custom" : "presence:" + presenceOrDefault().wireName();
    }

    @JsonIgnore
    public PresenceMode presenceOrDefault() {
        return presence != null ? presence : PresenceMode.PARITY;
    }

    /**
     * Значение параметра шаблона по имени ({@code tolerance}, {@code pattern}, ...)
     */
    public Object parameter(String name) {
        return switch (name) {
            case "tolerance" -> tolerance;
            case "seconds" -> seconds;
            case "millis" -> millis;
            case "length" -> length;
            case "pattern" -> pattern;
            case "substring" -> substring;
            case "min" -> min;
            case "max" -> max;
            default -> null;
        };
    }
}
