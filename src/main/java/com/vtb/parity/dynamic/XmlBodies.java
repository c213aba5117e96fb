package com.vtb.parity.dynamic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.deser.FromXmlParser;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * XML-тела запросов и ответов в терминах JSON-дерева.
 *
 * Ответ превращается в {@code {корневой-тег: содержимое}}: пространства имён отбрасываются,
 * повторяющиеся теги дают массив, пустой элемент даёт null, текст рядом с атрибутами лежит в {@code #text}.
 * Атрибуты становятся обычными полями.
 */
final class XmlBodies {

    static final String TEXT_FIELD = "#text";

    private static final XmlMapper XML_MAPPER = createMapper();

    private XmlBodies() {
    }

    private static XmlMapper createMapper() {
        return XmlMapper.builder()
                .nameForTextElement(TEXT_FIELD)
                .enable(FromXmlParser.Feature.EMPTY_ELEMENT_AS_NULL)
                .build();
    }

    static boolean isXml(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("xml");
    }

    /**
     * Тело запроса: объект ровно с одним полем становится корневым элементом.
     * Пусто, если тело не укладывается в один корень.
     */
    static Optional<byte[]> write(JsonNode body) throws IOException {
        if (body == null || !body.isObject() || body.size() != 1) {
            return Optional.empty();
        }
        Map.Entry<String, JsonNode> root = body.fields().next();
        return Optional.of(XML_MAPPER.writer().withRootName(root.getKey()).writeValueAsBytes(root.getValue()));
    }

    /**
     * @throws IOException документ не является корректным XML
     */
    static JsonNode read(byte[] bytes) throws IOException {
        try (FromXmlParser parser = (FromXmlParser) XML_MAPPER.getFactory().createParser(bytes)) {
            // парсер уже стоит на корневом элементе
            String rootName = parser.getStaxReader().getLocalName();
            JsonNode content = XML_MAPPER.readTree(parser);
            ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
            wrapped.set(rootName, content == null || content.isMissingNode() ? JsonNodeFactory.instance.nullNode() : content);
            return wrapped;
        }
    }
}
