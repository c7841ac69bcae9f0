package com.opencrawl.config;

import java.time.Duration;
import java.util.List;

public record ProxySettings(
    List<String> addresses,
    String file,
    String testUrl,
    Duration probeTimeout,
    int failureThreshold,
    Duration revalidateAfter
) {
    public ProxySettings {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
        failureThreshold = Math.max(1, failureThreshold);
    }

    public boolean hasSource() {
        return !addresses.isEmpty() || (file != null && !file.isBlank());
    }
}
