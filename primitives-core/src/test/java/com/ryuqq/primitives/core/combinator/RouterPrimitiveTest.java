package com.ryuqq.primitives.core.combinator;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.Primitives;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ConfigurationException;
import com.ryuqq.primitives.core.error.RoutingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RouterPrimitive 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("RouterPrimitive 테스트")
class RouterPrimitiveTest {

    private final Primitive<String, String> fast = Primitives.function("fast", s -> "fast:" + s);
    private final Primitive<String, String> quality = Primitives.function("quality", s -> "quality:" + s);

    @Test
    @DisplayName("selector가 고른 route를 실행하고 metadata에 기록한다")
    void 선택된_route_실행() throws Exception {
        // given
        RouterPrimitive<String, String> router = RouterPrimitive.<String, String>builder(
                (in, ctx) -> in.length() > 5 ? "quality" : "fast")
            .route("fast", fast)
            .route("quality", quality)
            .build();
        Context context = Context.create();

        // when
        String result = router.execute("long input", context);

        // then
        assertThat(result).isEqualTo("quality:long input");
        assertThat(context.metadata()).containsEntry(RouterPrimitive.ROUTE_METADATA_KEY, "quality");
    }

    @Test
    @DisplayName("없는 route 키는 default route로 간다")
    void default_route() throws Exception {
        // given
        RouterPrimitive<String, String> router = RouterPrimitive.<String, String>builder((in, ctx) -> "unknown")
            .route("fast", fast)
            .route("quality", quality)
            .defaultRoute("fast")
            .build();
        Context context = Context.create();

        // when
        String result = router.execute("x", context);

        // then
        assertThat(result).isEqualTo("fast:x");
        assertThat(context.metadata()).containsEntry("router.route", "fast");
    }

    @Test
    @DisplayName("없는 route 키이고 default가 없으면 RoutingException")
    void default_없음_RoutingException() {
        // given
        RouterPrimitive<String, String> router = RouterPrimitive.<String, String>builder((in, ctx) -> "unknown")
            .route("fast", fast)
            .build();

        // when & then
        assertThatThrownBy(() -> router.execute("x", Context.create()))
            .isInstanceOfSatisfying(RoutingException.class,
                e -> assertThat(e.getRouteKey()).isEqualTo("unknown"));
    }

    @Test
    @DisplayName("selector가 null을 반환하면 default route를 사용한다")
    void null_키_default() throws Exception {
        // given
        RouterPrimitive<String, String> router = RouterPrimitive.<String, String>builder((in, ctx) -> null)
            .route("fast", fast)
            .defaultRoute("fast")
            .build();

        // when & then
        assertThat(router.execute("x", Context.create())).isEqualTo("fast:x");
    }

    @Test
    @DisplayName("route가 없으면 ConfigurationException")
    void 빈_routes_구성_오류() {
        assertThatThrownBy(() -> new RouterPrimitive<String, String>((in, ctx) -> "a", Map.of(), null))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("default route가 route 목록에 없으면 ConfigurationException")
    void default_route_미등록_구성_오류() {
        // given
        Map<String, Primitive<String, String>> routes = new LinkedHashMap<>();
        routes.put("fast", fast);

        // when & then
        assertThatThrownBy(() -> new RouterPrimitive<String, String>((in, ctx) -> "fast", routes, "quality"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("quality");
    }

    @Test
    @DisplayName("route 등록 순서를 유지한다")
    void 등록_순서_유지() {
        // given
        RouterPrimitive<String, String> router = RouterPrimitive.<String, String>builder((in, ctx) -> "b")
            .route("b", quality)
            .route("a", fast)
            .build();

        // when & then
        assertThat(router.routes().keySet()).containsExactly("b", "a");
        assertThat(router.defaultRoute()).isEmpty();
    }
}
