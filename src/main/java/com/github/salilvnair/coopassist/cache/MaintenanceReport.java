package com.github.salilvnair.coopassist.cache;

public record MaintenanceReport(
        int scanned,
        int evicted,
        int ttlAdjusted,
        int countersDropped,
        int batches
) {}
