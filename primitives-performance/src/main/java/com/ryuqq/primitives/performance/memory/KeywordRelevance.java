package com.ryuqq.primitives.performance.memory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 키워드/태그 일치 기반 기본 관련도.
 *
 * <ul>
 *   <li>검색어를 공백으로 나눈 단어 중 내용이나 키에 포함된 단어 수 (대소문자 무시)</li>
 *   <li>질의 태그 중 항목이 가진 태그 수</li>
 *   <li>검색어와 태그가 모두 없으면 모든 항목에 1.0</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class KeywordRelevance implements RelevanceFunction {

    public static final KeywordRelevance INSTANCE = new KeywordRelevance();

    private KeywordRelevance() {
    }

    @Override
    public double score(MemoryQuery query, DeepMemoryEntry entry) {
        if (!query.hasText() && query.tags().isEmpty()) {
            return 1.0;
        }

        double score = 0.0;
        if (query.hasText()) {
            String haystack = (entry.key() + " " + entry.content()).toLowerCase(Locale.ROOT);
            for (String term : terms(query.text())) {
                if (haystack.contains(term)) {
                    score += 1.0;
                }
            }
        }
        for (String tag : query.tags()) {
            if (entry.tags().contains(tag)) {
                score += 1.0;
            }
        }
        return score;
    }

    private static Set<String> terms(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).trim().split("\\s+"))
            .collect(Collectors.toSet());
    }
}
