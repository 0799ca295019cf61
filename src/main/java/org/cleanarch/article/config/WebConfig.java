package org.cleanarch.article.config;

import org.cleanarch.article.api.filter.CorsHeadersFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CORS for the article API. The allowed origin comes from {@code app.cors.allowed-origin}.
 * Headers are set ahead of the error filters so error responses carry them too.
 */
@Configuration
public class WebConfig {

    @Bean
    public FilterRegistrationBean<CorsHeadersFilter> corsHeadersFilter(
            @Value("${app.cors.allowed-origin:*}") String allowedOrigin) {
        FilterRegistrationBean<CorsHeadersFilter> registration =
                new FilterRegistrationBean<>(new CorsHeadersFilter(allowedOrigin));
        registration.setOrder(ErrorHandlingConfig.CORS_ORDER);
        return registration;
    }
}
