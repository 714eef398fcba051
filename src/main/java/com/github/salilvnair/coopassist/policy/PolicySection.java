package com.github.salilvnair.coopassist.policy;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PolicySection {
    private String name;
    private List<String> sentences = new ArrayList<>();
}
