package com.vtb.parity.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.curiousoddman.rgxgen.RgxGen;
import com.vtb.parity.models.GenerationMode;
import io.swagger.v3.oas.models.media.Schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Генерация JSON-значения по схеме OpenAPI.
 *
 * POSITIVE: значение удовлетворяет схеме (тип, формат, enum, pattern, границы, required).
 * EXPLORATORY: с вероятностью {@link #VIOLATION_RATE} на узел значение нарушает схему.
 * Необязательные поля объектов включаются с вероятностью 1/2 в обоих режимах.
 */
public class SchemaValueGenerator {

    static final int MAX_DEPTH = 8;
    static final double VIOLATION_RATE = 0.3;
    private static final int PATTERN_ATTEMPTS = 20;
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    // секунды всегда присутствуют, ISO_OFFSET_DATE_TIME опускает нулевые
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");

    private final Random random;
    private final GenerationMode mode;
    private final Map<String, RgxGen> patterns = new HashMap<>();

    public SchemaValueGenerator(Random random, GenerationMode mode) {
        this.random = random;
        this.mode = mode != null ? mode : GenerationMode.POSITIVE;
    }

    public JsonNode generate(Schema<?> schema) {
        return generate(schema, 0);
    }

    JsonNode generate(Schema<?> schema, int depth) {
        if (depth > MAX_DEPTH * 2) {
            throw new GenerationException("Слишком глубокая вложенность обязательных полей схемы (> " + MAX_DEPTH * 2 + ")");
        }
        if (schema == null) {
            return NODES.textNode(word(1, 12));
        }
        if (mode == GenerationMode.EXPLORATORY && random.nextDouble() < VIOLATION_RATE) {
            return violate(schema, depth);
        }

        List<Object> enumValues = enumValues(schema);
        if (!enumValues.isEmpty()) {
            return MAPPER.valueToTree(enumValues.get(random.nextInt(enumValues.size())));
        }
        if (schema.getAllOf() != null && !schema.getAllOf().isEmpty()) {
            return generate(mergeAllOf(schema), depth);
        }
        if (schema.getOneOf() != null && !schema.getOneOf().isEmpty()) {
            return generate(pick(schema.getOneOf()), depth + 1);
        }
        if (schema.getAnyOf() != null && !schema.getAnyOf().isEmpty()) {
            return generate(pick(schema.getAnyOf()), depth + 1);
        }

        return switch (typeOf(schema)) {
            case "object" -> object(schema, depth);
            case "array" -> array(schema, depth);
            case "integer" -> NODES.numberNode(integer(schema));
            case "number" -> NODES.numberNode(number(schema));
            case "boolean" -> NODES.booleanNode(random.nextBoolean());
            default -> NODES.textNode(string(schema));
        };
    }

    static String typeOf(Schema<?> schema) {
        if (schema.getType() != null) {
            return schema.getType().toLowerCase(Locale.ROOT);
        }
        if (schema.getTypes() != null) {
            for (String type : schema.getTypes()) {
                if (type != null && !"null".equals(type)) {
                    return type.toLowerCase(Locale.ROOT);
                }
            }
        }
        if (schema.getProperties() != null && !schema.getProperties().isEmpty()) {
            return "object";
        }
        if (schema.getItems() != null) {
            return "array";
        }
        return "string";
    }

    private JsonNode object(Schema<?> schema, int depth) {
        ObjectNode node = NODES.objectNode();
        Map<String, Schema> properties = schema.getProperties() != null ? schema.getProperties() : Map.of();
        Set<String> required = schema.getRequired() != null ? new HashSet<>(schema.getRequired()) : Set.of();

        for (Map.Entry<String, Schema> property : properties.entrySet()) {
            String name = property.getKey();
            Schema<?> propertySchema = property.getValue();
            boolean mandatory = required.contains(name);
            if (!mandatory) {
                // глубже лимита только обязательные поля, чтобы рекурсивные схемы сходились
                if (depth >= MAX_DEPTH || Boolean.TRUE.equals(propertySchema.getReadOnly()) || !random.nextBoolean()) {
                    continue;
                }
            }
            node.set(name, generate(propertySchema, depth + 1));
        }
        for (String name : required) {
            if (!node.has(name) && !properties.containsKey(name)) {
                node.put(name, word(1, 12));
            }
        }
        return node;
    }

    private JsonNode array(Schema<?> schema, int depth) {
        int min = schema.getMinItems() != null ? schema.getMinItems() : 0;
        int max = schema.getMaxItems() != null ? schema.getMaxItems() : min + 3;
        if (depth >= MAX_DEPTH) {
            max = min;
        }
        if (max < min) {
            throw new GenerationException("maxItems (" + max + ") меньше minItems (" + min + ")");
        }
        int size = min + random.nextInt(max - min + 1);
        boolean unique = Boolean.TRUE.equals(schema.getUniqueItems());

        ArrayNode node = NODES.arrayNode();
        Set<JsonNode> seen = new LinkedHashSet<>();
        int attempts = 0;
        while (node.size() < size && attempts < size * 10 + 10) {
            attempts++;
            JsonNode item = generate(schema.getItems(), depth + 1);
            if (unique && !seen.add(item)) {
                continue;
            }
            node.add(item);
        }
        if (node.size() < min) {
            throw new GenerationException("Не удалось сгенерировать " + min + " уникальных элементов массива");
        }
        return node;
    }

    private long integer(Schema<?> schema) {
        BigDecimal minimum = schema.getMinimum();
        BigDecimal maximum = schema.getMaximum();
        boolean exclusiveMin = Boolean.TRUE.equals(schema.getExclusiveMinimum());
        boolean exclusiveMax = Boolean.TRUE.equals(schema.getExclusiveMaximum());
        if (schema.getExclusiveMinimumValue() != null) {
            minimum = schema.getExclusiveMinimumValue();
            exclusiveMin = true;
        }
        if (schema.getExclusiveMaximumValue() != null) {
            maximum = schema.getExclusiveMaximumValue();
            exclusiveMax = true;
        }

        long low;
        long high;
        if (minimum != null) {
            low = toLong(minimum, RoundingMode.CEILING);
            if (exclusiveMin && minimum.compareTo(BigDecimal.valueOf(low)) == 0) {
                low++;
            }
        } else {
            low = maximum != null ? toLong(maximum, RoundingMode.FLOOR) - 1000 : 1;
        }
        if (maximum != null) {
            high = toLong(maximum, RoundingMode.FLOOR);
            if (exclusiveMax && maximum.compareTo(BigDecimal.valueOf(high)) == 0) {
                high--;
            }
        } else {
            high = low + 1000;
        }
        if ("int32".equals(schema.getFormat())) {
            low = Math.max(low, Integer.MIN_VALUE);
            high = Math.min(high, Integer.MAX_VALUE);
        }
        if (low > high) {
            throw new GenerationException("Пустой диапазон целых: [" + low + ", " + high + "]");
        }

        BigDecimal multipleOf = schema.getMultipleOf();
        if (multipleOf != null && multipleOf.signum() > 0) {
            long step = multipleOf.setScale(0, RoundingMode.CEILING).longValue();
            long first = Math.floorDiv(low + step - 1, step);
            long last = Math.floorDiv(high, step);
            if (first > last) {
                throw new GenerationException("Нет кратных " + step + " в диапазоне [" + low + ", " + high + "]");
            }
            return (first + nextLong(last - first + 1)) * step;
        }
        return low + nextLong(high - low + 1);
    }

    private static long toLong(BigDecimal bound, RoundingMode rounding) {
        try {
            return bound.setScale(0, rounding).longValueExact();
        } catch (ArithmeticException e) {
            throw new GenerationException("Граница " + bound.toPlainString() + " вне диапазона 64-битных целых");
        }
    }

    private BigDecimal number(Schema<?> schema) {
        BigDecimal minimum = schema.getMinimum();
        BigDecimal maximum = schema.getMaximum();
        boolean exclusiveMin = Boolean.TRUE.equals(schema.getExclusiveMinimum());
        boolean exclusiveMax = Boolean.TRUE.equals(schema.getExclusiveMaximum());
        if (schema.getExclusiveMinimumValue() != null) {
            minimum = schema.getExclusiveMinimumValue();
            exclusiveMin = true;
        }
        if (schema.getExclusiveMaximumValue() != null) {
            maximum = schema.getExclusiveMaximumValue();
            exclusiveMax = true;
        }
        if (minimum == null) {
            exclusiveMin = false;
            minimum = maximum != null ? maximum.subtract(BigDecimal.valueOf(1000)) : BigDecimal.ZERO;
        }
        if (maximum == null) {
            exclusiveMax = false;
            maximum = minimum.add(BigDecimal.valueOf(1000));
        }
        int order = minimum.compareTo(maximum);
        if (order > 0 || order == 0 && (exclusiveMin || exclusiveMax)) {
            throw new GenerationException("Пустой диапазон чисел: " + (exclusiveMin ? "(" : "[")
                + minimum + ", " + maximum + (exclusiveMax ? ")" : "]"));
        }

        BigDecimal multipleOf = schema.getMultipleOf();
        if (multipleOf != null && multipleOf.signum() > 0) {
            BigDecimal first = minimum.divide(multipleOf, 0, RoundingMode.CEILING);
            if (exclusiveMin && first.multiply(multipleOf).compareTo(minimum) == 0) {
                first = first.add(BigDecimal.ONE);
            }
            BigDecimal last = maximum.divide(multipleOf, 0, RoundingMode.FLOOR);
            if (exclusiveMax && last.multiply(multipleOf).compareTo(maximum) == 0) {
                last = last.subtract(BigDecimal.ONE);
            }
            if (first.compareTo(last) > 0) {
                throw new GenerationException("Нет кратных " + multipleOf + " в диапазоне "
                    + (exclusiveMin ? "(" : "[") + minimum + ", " + maximum + (exclusiveMax ? ")" : "]"));
            }
            BigDecimal span = last.subtract(first).add(BigDecimal.ONE);
            long offset = span.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) >= 0
                ? nextLong(Long.MAX_VALUE)
                : nextLong(span.longValue());
            return first.add(BigDecimal.valueOf(offset)).multiply(multipleOf);
        }

        if (order == 0) {
            return minimum;
        }
        double low = minimum.doubleValue();
        double high = maximum.doubleValue();
        // случайная точка внутри отрезка: исключающие границы не достигаются
        double value = low + (high - low) * (0.05 + 0.9 * random.nextDouble());
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
        if (rounded.compareTo(minimum) <= 0 || rounded.compareTo(maximum) >= 0) {
            return minimum.add(maximum).divide(BigDecimal.valueOf(2));
        }
        return rounded;
    }

    private String string(Schema<?> schema) {
        int minLength = schema.getMinLength() != null ? schema.getMinLength() : 1;
        Integer maxLength = schema.getMaxLength();
        if (maxLength != null && maxLength < minLength) {
            throw new GenerationException("maxLength (" + maxLength + ") меньше minLength (" + minLength + ")");
        }

        if (schema.getPattern() != null) {
            return fromPattern(schema.getPattern(), minLength, maxLength);
        }
        String formatted = formatted(schema.getFormat());
        if (formatted != null) {
            return formatted;
        }
        int upper = maxLength != null ? maxLength : minLength + 11;
        return word(minLength, upper);
    }

    private String formatted(String format) {
        if (format == null) {
            return null;
        }
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "uuid" -> new UUID(random.nextLong(), random.nextLong()).toString();
            case "date-time" -> randomDateTime().atOffset(ZoneOffset.UTC).format(DATE_TIME);
            case "date" -> LocalDate.of(2020, 1, 1).plusDays(random.nextInt(2000)).toString();
            case "time" -> String.format("%02d:%02d:%02dZ", random.nextInt(24), random.nextInt(60), random.nextInt(60));
            case "email" -> word(3, 10).toLowerCase(Locale.ROOT) + "@example.com";
            case "uri", "url" -> "https://example.com/" + word(3, 10).toLowerCase(Locale.ROOT);
            case "hostname" -> word(3, 10).toLowerCase(Locale.ROOT) + ".example.com";
            case "ipv4" -> (1 + random.nextInt(223)) + "." + random.nextInt(256) + "." + random.nextInt(256) + "." + (1 + random.nextInt(254));
            case "ipv6" -> String.format("2001:db8::%x:%x", random.nextInt(0xffff), random.nextInt(0xffff));
            case "byte" -> {
                byte[] bytes = new byte[3 + random.nextInt(12)];
                random.nextBytes(bytes);
                yield Base64.getEncoder().encodeToString(bytes);
            }
            default -> null;
        };
    }

    private LocalDateTime randomDateTime() {
        return LocalDateTime.of(2020, 1, 1, 0, 0)
            .plusSeconds((long) random.nextInt(5 * 365 * 24 * 3600));
    }

    private String fromPattern(String pattern, int minLength, Integer maxLength) {
        Pattern compiled;
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new GenerationException("Некорректный pattern '" + pattern + "': " + e.getDescription(), e);
        }
        RgxGen generator = patterns.computeIfAbsent(pattern, p -> new RgxGen(stripAnchors(p)));
        for (int attempt = 0; attempt < PATTERN_ATTEMPTS; attempt++) {
            String candidate;
            try {
                candidate = generator.generate(random);
            } catch (RuntimeException e) {
                throw new GenerationException("pattern '" + pattern + "' не поддерживается генератором: " + e.getMessage(), e);
            }
            boolean lengthOk = candidate.length() >= minLength && (maxLength == null || candidate.length() <= maxLength);
            if (lengthOk && compiled.matcher(candidate).find()) {
                return candidate;
            }
        }
        throw new GenerationException("Не удалось получить строку для pattern '" + pattern + "' с длиной ["
            + minLength + ", " + (maxLength != null ? maxLength : "∞") + "]");
    }

    static String stripAnchors(String pattern) {
        String result = pattern;
        if (result.startsWith("^")) {
            result = result.substring(1);
        }
        if (result.endsWith("$") && !result.endsWith("\\$")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private JsonNode violate(Schema<?> schema, int depth) {
        String type = typeOf(schema);
        boolean wrongType = random.nextBoolean();
        if (!enumValues(schema).isEmpty() && !wrongType) {
            return NODES.textNode("__not_in_enum__");
        }
        return switch (type) {
            case "integer", "number" -> wrongType
                ? NODES.textNode("not-a-number")
                : NODES.numberNode(schema.getMaximum() != null
                    ? schema.getMaximum().add(BigDecimal.ONE)
                    : BigDecimal.valueOf(Long.MAX_VALUE).add(BigDecimal.ONE));
            case "boolean" -> NODES.textNode("maybe");
            case "array" -> NODES.textNode("not-an-array");
            case "object" -> {
                if (wrongType || schema.getRequired() == null || schema.getRequired().isEmpty()) {
                    yield NODES.arrayNode();
                }
                ObjectNode valid = (ObjectNode) object(schema, depth);
                valid.remove(schema.getRequired().get(random.nextInt(schema.getRequired().size())));
                yield valid;
            }
            default -> {
                if (wrongType) {
                    yield NODES.numberNode(random.nextInt(100000));
                }
                int length = schema.getMaxLength() != null ? schema.getMaxLength() + 1 + random.nextInt(5) : 300;
                yield NODES.textNode("!" + word(length, length));
            }
        };
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private Schema<?> mergeAllOf(Schema<?> schema) {
        Schema merged = new Schema<>();
        Map<String, Schema> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        String type = schema.getType();
        for (Schema<?> part : schema.getAllOf()) {
            Schema<?> resolved = part.getAllOf() != null && !part.getAllOf().isEmpty() ? mergeAllOf(part) : part;
            if (resolved.getProperties() != null) {
                properties.putAll(resolved.getProperties());
            }
            if (resolved.getRequired() != null) {
                required.addAll(resolved.getRequired());
            }
            if (type == null && resolved.getType() != null) {
                type = resolved.getType();
            }
            if (resolved.getProperties() == null && resolved.getType() != null && !"object".equals(resolved.getType())) {
                return resolved;
            }
        }
        if (schema.getProperties() != null) {
            properties.putAll(schema.getProperties());
        }
        if (schema.getRequired() != null) {
            required.addAll(schema.getRequired());
        }
        merged.setType(type != null ? type : "object");
        merged.setProperties(properties);
        merged.setRequired(new ArrayList<>(new LinkedHashSet<>(required)));
        return merged;
    }

    private static List<Object> enumValues(Schema<?> schema) {
        List<Object> values = new ArrayList<>();
        if (schema.getEnum() != null) {
            for (Object value : schema.getEnum()) {
                if (value != null) {
                    values.add(value);
                }
            }
        }
        return values;
    }

    private Schema<?> pick(List<Schema> options) {
        return options.get(random.nextInt(options.size()));
    }

    private String word(int minLength, int maxLength) {
        int length = minLength + random.nextInt(Math.max(1, maxLength - minLength + 1));
        StringBuilder out = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            out.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return out.toString();
    }

    private long nextLong(long bound) {
        if (bound <= Integer.MAX_VALUE) {
            return random.nextInt((int) bound);
        }
        return Math.floorMod(random.nextLong(), bound);
    }
}
