package com.github.dimitryivaniuta.metergateway.web.dto;

public record InvalidateResponse(String pattern, int removed) {}
