package org.caureq.opsanomaly.security;

import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

final class KeyChecks {

    private KeyChecks() {
    }

    /** Constant-time comparison; a null on either side never matches. */
    static boolean matches(String expected, String presented) {
        if (expected == null || presented == null) return false;
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }

    static void reject(HttpServletResponse res, HttpStatus status, String message) throws IOException {
        res.setStatus(status.value());
        res.setContentType("application/json");
        res.getWriter().write("{\"error\":\"" + status.name().toLowerCase() + "\",\"message\":\"" + message + "\"}");
    }
}
