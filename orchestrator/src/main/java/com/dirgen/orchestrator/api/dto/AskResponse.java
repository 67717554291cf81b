package com.dirgen.orchestrator.api.dto;

public record AskResponse(String text) {}
