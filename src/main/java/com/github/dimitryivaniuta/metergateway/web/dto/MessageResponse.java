package com.github.dimitryivaniuta.metergateway.web.dto;

public record MessageResponse(String message) {}
