package com.codeveil.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
