package com.github.salilvnair.coopassist.policy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyCategory {
    private String name;
    private String displayName;
    @Builder.Default
    private List<String> keywords = new ArrayList<>();
    @Builder.Default
    private List<String> priorityKeywords = new ArrayList<>();
}
