package com.ryuqq.primitives.performance.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.primitives.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON 파일에서 Architectural Fact 목록 로딩.
 *
 * <p><strong>형식:</strong></p>
 * <pre>{@code
 * {
 *   "facts": [
 *     {
 *       "key": "test-coverage",
 *       "category": "QUAL",
 *       "comparison": "AT_LEAST",
 *       "expected": 80,
 *       "rationale": "Minimum line coverage",
 *       "status": "ACTIVE"
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>status를 생략하면 ACTIVE, DEPRECATED면 deprecationReason을 함께 적습니다.
 * expected는 숫자, 문자열, 불리언, 또는 그 배열(ONE_OF)입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FactRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(FactRegistryLoader.class);

    private final ObjectMapper mapper;

    public FactRegistryLoader() {
        this(new ObjectMapper());
    }

    public FactRegistryLoader(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 스트림에서 사실 목록 읽기.
     *
     * @throws IOException JSON 파싱 실패
     * @throws ConfigurationException 필수 필드 누락 또는 알 수 없는 comparison/status
     */
    public List<ArchitecturalFact> load(InputStream in) throws IOException {
        if (in == null) {
            throw new IllegalArgumentException("in cannot be null");
        }
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.path("facts").isArray()) {
            throw new ConfigurationException("Fact registry must contain a 'facts' array");
        }
        List<ArchitecturalFact> facts = new ArrayList<>();
        for (JsonNode node : root.path("facts")) {
            facts.add(toFact(node));
        }
        return facts;
    }

    public List<ArchitecturalFact> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /**
     * 읽은 사실을 레지스트리에 등록.
     *
     * @return 새로 등록된 수
     */
    public int loadInto(FactMemory memory, InputStream in) throws IOException {
        List<ArchitecturalFact> facts = load(in);
        int registered = memory.registerAll(facts);
        log.info("Loaded {} facts ({} newly registered)", facts.size(), registered);
        return registered;
    }

    public int loadInto(FactMemory memory, Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return loadInto(memory, in);
        }
    }

    private ArchitecturalFact toFact(JsonNode node) {
        String key = requiredText(node, "key", "<unknown>");
        String category = requiredText(node, "category", key);
        Comparison comparison = enumValue(Comparison.class, requiredText(node, "comparison", key), key);
        JsonNode expectedNode = node.get("expected");
        if (expectedNode == null || expectedNode.isNull()) {
            throw new ConfigurationException("Fact '" + key + "' is missing 'expected'");
        }
        String rationale = node.path("rationale").asText("");
        FactStatus status = node.hasNonNull("status")
            ? enumValue(FactStatus.class, node.get("status").asText(), key)
            : FactStatus.ACTIVE;
        String deprecationReason = node.hasNonNull("deprecationReason") ? node.get("deprecationReason").asText() : null;
        return new ArchitecturalFact(key, category, toValue(expectedNode), comparison, rationale, status, deprecationReason);
    }

    private static String requiredText(JsonNode node, String field, String key) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ConfigurationException("Fact '" + key + "' is missing '" + field + "'");
        }
        return value.asText();
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String raw, String key) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Fact '" + key + "' has unknown " + type.getSimpleName() + " '" + raw + "'"
            );
        }
    }

    private static Object toValue(JsonNode node) {
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            for (JsonNode element : node) {
                values.add(toValue(element));
            }
            return List.copyOf(values);
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }
}
