package com.ryuqq.primitives.performance.memory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 기대 값과 실제 값의 비교 방식.
 *
 * <p>숫자는 {@link Number} 또는 숫자 문자열을 {@link BigDecimal}로 변환해 비교하므로
 * {@code 80}, {@code 80.0}, {@code "80"}은 같은 값입니다.
 * 타입이 맞지 않으면 {@link IllegalArgumentException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Comparison {

    /** 같음. 둘 다 숫자로 해석되면 숫자 비교. */
    EQUALS("==") {
        @Override
        public boolean test(Object expected, Object actual) {
            BigDecimal left = numberOrNull(expected);
            BigDecimal right = numberOrNull(actual);
            if (left != null && right != null) {
                return left.compareTo(right) == 0;
            }
            return Objects.equals(String.valueOf(expected), String.valueOf(actual));
        }
    },

    /** 실제 값 >= 기대 값. */
    AT_LEAST(">=") {
        @Override
        public boolean test(Object expected, Object actual) {
            return number(actual, "actual").compareTo(number(expected, "expected")) >= 0;
        }
    },

    /** 실제 값 <= 기대 값. */
    AT_MOST("<=") {
        @Override
        public boolean test(Object expected, Object actual) {
            return number(actual, "actual").compareTo(number(expected, "expected")) <= 0;
        }
    },

    /** 실제 값의 문자열이 기대 정규식과 전체 일치. */
    MATCHES("matches") {
        @Override
        public boolean test(Object expected, Object actual) {
            if (!(expected instanceof String regex)) {
                throw new IllegalArgumentException("MATCHES expects a regex string but was: " + expected);
            }
            return Pattern.compile(regex).matcher(String.valueOf(actual)).matches();
        }
    },

    /** 실제 값이 기대 목록 중 하나와 같음 (EQUALS 규칙). */
    ONE_OF("one of") {
        @Override
        public boolean test(Object expected, Object actual) {
            if (!(expected instanceof Collection<?> candidates)) {
                throw new IllegalArgumentException("ONE_OF expects a collection but was: " + expected);
            }
            for (Object candidate : candidates) {
                if (EQUALS.test(candidate, actual)) {
                    return true;
                }
            }
            return false;
        }
    };

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    /**
     * 비교 실행.
     *
     * @param expected 기대 값
     * @param actual 실제 값
     * @return 통과 여부
     * @throws IllegalArgumentException 타입이 비교 방식과 맞지 않는 경우
     */
    public abstract boolean test(Object expected, Object actual);

    /**
     * 사람이 읽을 기대 조건 (예: {@code ">= 80"}).
     */
    public String describe(Object expected) {
        return symbol + " " + expected;
    }

    private static BigDecimal number(Object value, String role) {
        BigDecimal number = numberOrNull(value);
        if (number == null) {
            throw new IllegalArgumentException(role + " value is not numeric: " + value);
        }
        return number;
    }

    private static BigDecimal numberOrNull(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
