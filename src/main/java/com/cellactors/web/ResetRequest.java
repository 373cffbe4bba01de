package com.cellactors.web;

import java.util.List;

public record ResetRequest(
        Integer width,
        Integer height,
        Double density,
        Long randomSeed,
        List<String> pattern
) {
}
