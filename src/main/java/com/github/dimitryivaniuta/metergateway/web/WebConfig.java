package com.github.dimitryivaniuta.metergateway.web;

import com.github.dimitryivaniuta.metergateway.config.GatewayProperties;
import com.github.dimitryivaniuta.metergateway.gateway.GatewayFacade;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final GatewayFacade facade;
    private final GatewayProperties properties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new GatewayRequestInterceptor(facade))
                .addPathPatterns(properties.getRateLimit().getProtectedPaths());
    }
}
