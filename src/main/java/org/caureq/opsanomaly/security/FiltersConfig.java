package org.caureq.opsanomaly.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Limits each key filter to the routes it guards; ingest runs first. */
@Configuration
public class FiltersConfig {

    @Bean
    public FilterRegistrationBean<ApiKeyFilter> ingestFilterRegistration(ApiKeyFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(5);
        reg.addUrlPatterns(ApiKeyFilter.INGEST_PATH, ApiKeyFilter.INGEST_PATH + "/*");
        return reg;
    }

    @Bean
    public FilterRegistrationBean<ApiKeyAdminFilter> adminFilterRegistration(ApiKeyAdminFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(10);
        reg.addUrlPatterns(ApiKeyAdminFilter.ADMIN_PREFIX + "*");
        return reg;
    }
}
