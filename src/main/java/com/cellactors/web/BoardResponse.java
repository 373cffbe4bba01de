package com.cellactors.web;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BoardResponse(
        int width,
        int height,
        long generation,
        @JsonProperty("alive")
        int aliveCount,
        String rule,
        List<String> rows
) {
}
