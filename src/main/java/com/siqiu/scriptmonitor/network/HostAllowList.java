package com.siqiu.scriptmonitor.network;

import java.util.List;
import java.util.Locale;

/**
 * Optional hostname allow-list. Empty means every host is permitted (address checks still apply).
 * A {@code *.example.com} entry matches subdomains of example.com but not example.com itself.
 */
public class HostAllowList {

    private final List<String> patterns;

    public HostAllowList(List<String> patterns) {
        this.patterns = patterns.stream()
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
    }

    public static HostAllowList permitAll() {
        return new HostAllowList(List.of());
    }

    public boolean isRestricted() {
        return !patterns.isEmpty();
    }

    public boolean permits(String host) {
        if (patterns.isEmpty()) return true;
        String h = stripTrailingDot(host.toLowerCase(Locale.ROOT));
        for (String pattern : patterns) {
            if (pattern.startsWith("*.")) {
                if (h.endsWith(pattern.substring(1))) return true;
            } else if (h.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static String stripTrailingDot(String host) {
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }
}
