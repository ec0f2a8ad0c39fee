package com.ryuqq.primitives.core.error;

import java.util.Set;

/**
 * 선택된 route 키에 해당하는 route가 없고 default route도 없는 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RoutingException extends PrimitiveException {

    private final String routeKey;

    /**
     * 생성자.
     *
     * @param routeKey selector가 반환한 키 (null 가능)
     * @param knownRoutes 등록된 route 이름
     */
    public RoutingException(String routeKey, Set<String> knownRoutes) {
        super("No route for key '" + routeKey + "' (known routes: " + knownRoutes + ")");
        this.routeKey = routeKey;
    }

    public String getRouteKey() {
        return routeKey;
    }
}
