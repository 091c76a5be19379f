package io.avalonrest.example;

import io.avalonrest.core.AvalonRestException;
import io.avalonrest.core.HttpMethod;
import io.avalonrest.server.core.ActionResult;
import io.avalonrest.server.core.ControllerBase;
import io.avalonrest.server.core.annotation.Authorize;
import io.avalonrest.server.core.annotation.Controller;
import io.avalonrest.server.core.annotation.Route;
import io.avalonrest.server.core.security.ClientAddressResolver;
import io.avalonrest.server.core.security.RateLimitStatistics;
import io.avalonrest.server.core.security.SlidingWindowRateLimiter;
import io.avalonrest.server.spi.BlockedIpRecord;

import java.util.List;
import java.util.Map;

/**
 * Rate limiter management, restricted to the {@code Admin} role.
 */
@Controller
@Authorize(roles = "Admin")
public class AdminController extends ControllerBase {

    private final SlidingWindowRateLimiter limiter;

    public AdminController(SlidingWindowRateLimiter limiter) {
        this.limiter = limiter;
    }

    @Route(path = "stats")
    public RateLimitStatistics stats() {
        return limiter.statistics();
    }

    @Route(path = "blocked")
    public List<BlockedIpRecord> blocked() {
        return limiter.blockedIps();
    }

    @Route(method = HttpMethod.DELETE, path = "blocked/{ip}")
    public ActionResult unblock(String ip) {
        requireIp(ip);
        return limiter.unblock(ip) ? noContent() : notFound("IP " + ip + " is not blocked");
    }

    @Route(method = HttpMethod.POST, path = "whitelist/{ip}")
    public Map<String, Object> whitelist(String ip) {
        requireIp(ip);
        limiter.addToWhitelist(ip);
        return Map.of("ip", ip, "whitelisted", true);
    }

    @Route(method = HttpMethod.DELETE, path = "whitelist/{ip}")
    public Map<String, Object> removeWhitelist(String ip) {
        requireIp(ip);
        return Map.of("ip", ip, "removed", limiter.removeFromWhitelist(ip));
    }

    @Route(method = HttpMethod.POST, path = "blacklist/{ip}")
    public Map<String, Object> blacklist(String ip) {
        requireIp(ip);
        limiter.addToBlacklist(ip);
        return Map.of("ip", ip, "blacklisted", true);
    }

    @Route(method = HttpMethod.DELETE, path = "blacklist/{ip}")
    public Map<String, Object> removeBlacklist(String ip) {
        requireIp(ip);
        return Map.of("ip", ip, "removed", limiter.removeFromBlacklist(ip));
    }

    private static void requireIp(String ip) {
        if (!ClientAddressResolver.isIpLiteral(ip)) {
            throw new AvalonRestException.BadInput("Not an IP address: " + ip);
        }
    }
}
