package com.vtb.parity.evaluator;

import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlScript;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Песочница JEXL: без доступа к System/Runtime/reflection/IO, строгая арифметика,
 * отменяемое выполнение (прерывание потока останавливает скрипт).
 * Поиск по регулярному выражению: {@code re:find(pattern, value)}.
 */
public class JexlExpressionEngine implements ExpressionEngine {

    static final int CACHE_LIMIT = 256;

    private final JexlEngine jexl;
    private final Map<String, JexlScript> compiled;

    public JexlExpressionEngine() {
        this.jexl = new JexlBuilder()
            .permissions(JexlPermissions.RESTRICTED)
            .namespaces(Map.of("re", RegexFunctions.class))
            .strict(true)
            .silent(false)
            .cancellable(true)
            .create();
        this.compiled = Collections.synchronizedMap(new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, JexlScript> eldest) {
                return size() > CACHE_LIMIT;
            }
        });
    }

    @Override
    public Object evaluate(String expression, Map<String, Object> bindings) {
        if (expression == null || expression.isBlank()) {
            throw new EvaluationException("empty expression");
        }
        JexlScript script = compile(expression);
        MapContext context = new MapContext(new HashMap<>(bindings != null ? bindings : Map.of()));
        try {
            return script.execute(context);
        } catch (JexlException.Cancel cancel) {
            throw new EvaluationException(EvaluatorProtocol.TIMEOUT_ERROR, cancel);
        } catch (JexlException e) {
            throw new EvaluationException("evaluation error: " + e.getMessage(), e);
        } catch (ArithmeticException | ClassCastException | IndexOutOfBoundsException e) {
            throw new EvaluationException("evaluation error: " + e.getMessage(), e);
        }
    }

    int cachedScripts() {
        return compiled.size();
    }

    private JexlScript compile(String expression) {
        JexlScript script = compiled.get(expression);
        if (script != null) {
            return script;
        }
        try {
            script = jexl.createScript(expression);
        } catch (JexlException e) {
            throw new EvaluationException("syntax error: " + e.getMessage(), e);
        }
        compiled.put(expression, script);
        return script;
    }
}
