package com.github.dimitryivaniuta.metergateway.web;

import com.github.dimitryivaniuta.metergateway.gateway.GatewayFacade;
import com.github.dimitryivaniuta.metergateway.gateway.auth.GatewayPrincipal;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.RateLimitDecision;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Authenticates and admits every request on a protected path before it reaches a controller.
 * Rejections are thrown and rendered by {@link GatewayExceptionHandler}.
 */
@RequiredArgsConstructor
public class GatewayRequestInterceptor implements HandlerInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final GatewayFacade facade;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        GatewayPrincipal principal = facade.authenticate(bearerToken(request));
        MDC.put(RequestContextKeys.PRINCIPAL_MDC_KEY, principal.id());

        RateLimitDecision decision = facade.admit(principal);
        RateLimitHeaders.apply(decision, response::setHeader);

        request.setAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE, principal);
        return true;
    }

    static String bearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.length() <= BEARER_PREFIX.length()
                || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return header.substring(BEARER_PREFIX.length()).trim();
    }
}
