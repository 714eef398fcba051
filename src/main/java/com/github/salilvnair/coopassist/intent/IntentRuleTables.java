package com.github.salilvnair.coopassist.intent;

public record IntentRuleTables(
        IntentRuleTable priority,
        IntentRuleTable general
) {}
