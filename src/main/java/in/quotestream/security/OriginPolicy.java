package in.quotestream.security;

import java.util.List;

/**
 * Browser origin allow-list for WebSocket upgrades and CORS headers.
 * A {@code *} entry allows every origin; requests without an Origin header
 * (non-browser clients) are always allowed.
 */
public final class OriginPolicy {

    private final List<String> allowed;
    private final boolean allowAll;

    public OriginPolicy(List<String> allowed) {
        this.allowed = List.copyOf(allowed);
        this.allowAll = this.allowed.contains("*");
    }

    public boolean isAllowed(String origin) {
        if (allowAll || origin == null || origin.isEmpty()) {
            return true;
        }
        return allowed.contains(origin);
    }

    /**
     * Value for {@code Access-Control-Allow-Origin}, or null when the origin is not allowed.
     */
    public String allowOriginHeader(String origin) {
        if (allowAll) {
            return "*";
        }
        if (origin != null && allowed.contains(origin)) {
            return origin;
        }
        return null;
    }
}
