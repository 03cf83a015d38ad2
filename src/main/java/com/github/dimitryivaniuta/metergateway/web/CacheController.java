package com.github.dimitryivaniuta.metergateway.web;

import com.github.dimitryivaniuta.metergateway.gateway.GatewayFacade;
import com.github.dimitryivaniuta.metergateway.gateway.auth.GatewayPrincipal;
import com.github.dimitryivaniuta.metergateway.web.dto.CacheStatsResponse;
import com.github.dimitryivaniuta.metergateway.web.dto.InvalidateResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final GatewayFacade facade;

    @GetMapping("/stats")
    public CacheStatsResponse stats() {
        return CacheStatsResponse.from(facade.cacheStats());
    }

    @DeleteMapping
    public InvalidateResponse invalidate(@RequestParam("pattern") String pattern,
                                         @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) GatewayPrincipal principal) {
        int removed = facade.invalidate(pattern);
        log.info("Cache invalidation pattern={} removed={} by principal={}", pattern, removed, principal.id());
        return new InvalidateResponse(pattern, removed);
    }
}
