package io.avalonrest.server.spi;

import java.util.Locale;

/**
 * Identity used to bucket rate-limit state more precisely than the raw address.
 *
 * @param ip resolved client address, or null when none could be determined
 * @param userAgent the {@code User-Agent} header, may be null
 * @param token the bearer token, may be null
 */
public record ClientKey(String ip, String userAgent, String token) {

    private static final int TOKEN_PREFIX_LENGTH = 10;

    public boolean hasIp() {
        return ip != null && !ip.isBlank() && !"unknown".equals(ip.toLowerCase(Locale.ROOT));
    }

    /**
     * Composite bucket key: {@code ip_userAgentHash_tokenPrefix}.
     */
    public String identifier() {
        String agentHash = userAgent == null || userAgent.isEmpty()
                ? "0"
                : Integer.toHexString(userAgent.hashCode());
        String tokenPrefix;
        if (token == null || token.isEmpty()) {
            tokenPrefix = "anon";
        } else {
            tokenPrefix = token.length() > TOKEN_PREFIX_LENGTH ? token.substring(0, TOKEN_PREFIX_LENGTH) : token;
        }
        return ip + "_" + agentHash + "_" + tokenPrefix;
    }
}
