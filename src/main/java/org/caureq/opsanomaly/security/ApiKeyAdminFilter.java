package org.caureq.opsanomaly.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.config.AdminProps;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Objects;

/**
 * Guards the training trigger and sampler control: X-ADMIN-API-KEY must match and the
 * caller must be on the allowlist. Rules are parsed once; a malformed rule is logged and
 * matches nothing.
 */
@Slf4j
@Component
public class ApiKeyAdminFilter extends OncePerRequestFilter {
    static final String ADMIN_PREFIX = "/api/admin/";

    private final String adminKey;
    private final List<IpRule> rules;

    public ApiKeyAdminFilter(AdminProps props) {
        this.adminKey = props.apiKey();
        this.rules = props.allowIps().stream()
                .map(String::trim)
                .map(IpRule::parse)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        return !req.getRequestURI().startsWith(ADMIN_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        if (!KeyChecks.matches(adminKey, req.getHeader("X-ADMIN-API-KEY"))) {
            KeyChecks.reject(res, HttpStatus.UNAUTHORIZED, "Missing or invalid X-ADMIN-API-KEY");
            return;
        }
        String ip = req.getRemoteAddr();
        if ("0:0:0:0:0:0:0:1".equals(ip) || "::1".equals(ip)) ip = "127.0.0.1";
        if (!isAllowed(ip)) {
            log.warn("[Admin] {} {} refused for {}", req.getMethod(), req.getRequestURI(), ip);
            KeyChecks.reject(res, HttpStatus.FORBIDDEN, "Address not allowed: " + ip);
            return;
        }
        chain.doFilter(req, res);
    }

    boolean isAllowed(String ip) {
        Integer addr = ipv4(ip);
        return rules.stream().anyMatch(r -> r.matches(addr));
    }

    /** IPv4 address as an int, null for anything else. */
    private static Integer ipv4(String ip) {
        try {
            byte[] b = InetAddress.getByName(ip).getAddress();
            if (b.length != 4) return null;
            return ((b[0] & 0xff) << 24) | ((b[1] & 0xff) << 16) | ((b[2] & 0xff) << 8) | (b[3] & 0xff);
        } catch (UnknownHostException e) {
            return null;
        }
    }

    /** "*" matches any caller; an exact address is a /32. */
    private record IpRule(boolean any, int network, int mask) {

        static IpRule parse(String rule) {
            if (rule.equals("*")) return new IpRule(true, 0, 0);
            String[] parts = rule.split("/", 2);
            Integer net = ipv4(parts[0]);
            try {
                int prefix = parts.length == 2 ? Integer.parseInt(parts[1]) : 32;
                if (net == null || prefix < 0 || prefix > 32) throw new NumberFormatException(rule);
                int mask = prefix == 0 ? 0 : 0xffffffff << (32 - prefix);
                return new IpRule(false, net & mask, mask);
            } catch (NumberFormatException e) {
                log.warn("[Admin] ignoring malformed allow-ips rule '{}'", rule);
                return null;
            }
        }

        boolean matches(Integer addr) {
            if (any) return true;
            return addr != null && (addr & mask) == network;
        }
    }
}
