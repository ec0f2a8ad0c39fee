package com.ryuqq.primitives.performance.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 기본 {@link CacheKeyFunction} 모음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .build();

    private CacheKeys() {
    }

    /**
     * 입력을 JSON으로 직렬화한 뒤 SHA-256 hex로 만든 키.
     *
     * <p>Map 키와 프로퍼티 순서를 정렬하므로 필드 선언 순서나 Map 구현에 관계없이 같은 키가 나옵니다.
     * 직렬화할 수 없는 입력은 {@link IllegalArgumentException}을 던집니다.</p>
     */
    public static <I> CacheKeyFunction<I> serializedInputHash() {
        return serializedInputHash(CANONICAL_MAPPER);
    }

    /**
     * 지정한 ObjectMapper로 직렬화한 뒤 SHA-256 hex로 만든 키.
     *
     * @param mapper 입력 직렬화에 사용할 ObjectMapper
     */
    public static <I> CacheKeyFunction<I> serializedInputHash(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        return (input, context) -> {
            try {
                return sha256(mapper.writeValueAsBytes(input));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException(
                    "Cache input is not serializable: " + input.getClass().getName(), e
                );
            }
        };
    }

    /**
     * {@link String#valueOf(Object)}를 그대로 키로 사용.
     */
    public static <I> CacheKeyFunction<I> toStringKey() {
        return (input, context) -> String.valueOf(input);
    }

    /**
     * Context의 sessionId를 앞에 붙여 세션별로 캐시를 분리.
     *
     * <p>sessionId가 없으면 {@code "-"}를 사용합니다.</p>
     *
     * @param delegate 입력 키 함수
     */
    public static <I> CacheKeyFunction<I> scopedBySession(CacheKeyFunction<I> delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        return (input, context) -> context.sessionId().orElse("-") + ":" + delegate.keyFor(input, context);
    }

    private static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
