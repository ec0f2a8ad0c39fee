package com.ryuqq.primitives.core.combinator;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ConfigurationException;
import com.ryuqq.primitives.core.error.RoutingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 조건 분기 조합기.
 *
 * <p>{@link RouteSelector}가 고른 이름의 route 하나만 실행합니다.</p>
 *
 * <p><strong>선택 규칙:</strong></p>
 * <ul>
 *   <li>등록된 이름: 해당 route 실행</li>
 *   <li>등록되지 않은 이름 (또는 null): default route 실행, 없으면 {@link RoutingException}</li>
 *   <li>실제 실행한 route 이름을 {@code router.route} metadata에 기록</li>
 * </ul>
 *
 * <p><strong>구성 검증:</strong> route가 하나도 없거나 default route가 route 목록에 없으면
 * 생성 시점에 {@link ConfigurationException}을 던집니다.</p>
 *
 * <pre>{@code
 * RouterPrimitive<Request, Response> router = RouterPrimitive.<Request, Response>builder((req, ctx) -> req.tier())
 *     .route("fast", fastModel)
 *     .route("quality", qualityModel)
 *     .defaultRoute("fast")
 *     .build();
 * }</pre>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RouterPrimitive<I, O> implements Primitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(RouterPrimitive.class);

    /**
     * 선택된 route 이름이 기록되는 metadata 키.
     */
    public static final String ROUTE_METADATA_KEY = "router.route";

    private final RouteSelector<? super I> selector;
    private final Map<String, Primitive<? super I, ? extends O>> routes;
    private final String defaultRoute;

    /**
     * 생성자.
     *
     * @param selector route 선택 함수
     * @param routes 이름별 route (등록 순서 유지)
     * @param defaultRoute default route 이름 (null이면 없음)
     * @throws IllegalArgumentException selector 또는 routes가 null인 경우
     * @throws ConfigurationException routes가 비어 있거나 defaultRoute가 routes에 없는 경우
     */
    public RouterPrimitive(
        RouteSelector<? super I> selector,
        Map<String, ? extends Primitive<? super I, ? extends O>> routes,
        String defaultRoute
    ) {
        if (selector == null) {
            throw new IllegalArgumentException("selector cannot be null");
        }
        if (routes == null) {
            throw new IllegalArgumentException("routes cannot be null");
        }
        if (routes.isEmpty()) {
            throw new ConfigurationException("RouterPrimitive requires at least one route");
        }
        if (defaultRoute != null && !routes.containsKey(defaultRoute)) {
            throw new ConfigurationException(
                "defaultRoute '" + defaultRoute + "' is not a registered route " + routes.keySet()
            );
        }
        this.selector = selector;
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<String, Primitive<? super I, ? extends O>>(routes));
        this.defaultRoute = defaultRoute;
    }

    public static <I, O> Builder<I, O> builder(RouteSelector<? super I> selector) {
        return new Builder<>(selector);
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        String key = selector.select(input, context);
        String selected = resolve(key);
        Primitive<? super I, ? extends O> route = routes.get(selected);

        context.metadata().put(ROUTE_METADATA_KEY, selected);
        log.debug("Router selected route {} (requested: {})", selected, key);
        return route.execute(input, context);
    }

    private String resolve(String key) {
        if (key != null && routes.containsKey(key)) {
            return key;
        }
        if (defaultRoute != null) {
            return defaultRoute;
        }
        throw new RoutingException(key, routes.keySet());
    }

    public Map<String, Primitive<? super I, ? extends O>> routes() {
        return routes;
    }

    public Optional<String> defaultRoute() {
        return Optional.ofNullable(defaultRoute);
    }

    /**
     * RouterPrimitive Builder.
     */
    public static final class Builder<I, O> {

        private final RouteSelector<? super I> selector;
        private final Map<String, Primitive<? super I, ? extends O>> routes = new LinkedHashMap<>();
        private String defaultRoute;

        private Builder(RouteSelector<? super I> selector) {
            this.selector = selector;
        }

        /**
         * route 등록.
         *
         * @throws IllegalArgumentException name이 비어 있거나 route가 null인 경우
         */
        public Builder<I, O> route(String name, Primitive<? super I, ? extends O> route) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (route == null) {
                throw new IllegalArgumentException("route cannot be null");
            }
            routes.put(name, route);
            return this;
        }

        public Builder<I, O> defaultRoute(String defaultRoute) {
            this.defaultRoute = defaultRoute;
            return this;
        }

        public RouterPrimitive<I, O> build() {
            return new RouterPrimitive<>(selector, routes, defaultRoute);
        }
    }
}
