package com.github.salilvnair.coopassist.engine.model;

import com.github.salilvnair.coopassist.engine.type.ClarificationKind;

import java.time.Instant;
import java.util.List;

public record PendingClarification(
        ClarificationKind kind,
        List<SelectableOption> options,
        Instant createdAt,
        Instant expiresAt
) {
    public PendingClarification {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public SelectableOption optionByPayload(String payload) {
        if (payload == null) {
            return null;
        }
        for (SelectableOption option : options) {
            if (option.payload().equals(payload)) {
                return option;
            }
        }
        return null;
    }

    /**
     * 1-based, matching the numbering users see next to the offered options.
     */
    public SelectableOption optionByOrdinal(int ordinal) {
        if (ordinal < 1 || ordinal > options.size()) {
            return null;
        }
        return options.get(ordinal - 1);
    }
}
