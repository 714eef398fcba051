package com.github.salilvnair.coopassist.catalog.resolver;

import java.util.List;

public record CategoryKeywordRule(
        String category,
        List<String> keywords
) {}
