package org.caureq.opsanomaly.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/** Admin route guard: shared key and the addresses (exact IPv4, CIDR or "*") allowed to call. */
@ConfigurationProperties(prefix = "admin")
public record AdminProps(String apiKey, List<String> allowIps) {

    public AdminProps {
        if (apiKey == null || apiKey.isBlank()) apiKey = "ADMIN-CHANGE-ME";
        if (allowIps == null || allowIps.isEmpty()) allowIps = List.of("127.0.0.1");
    }
}
