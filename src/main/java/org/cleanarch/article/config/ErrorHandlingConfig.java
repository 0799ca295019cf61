package org.cleanarch.article.config;

import org.cleanarch.article.api.exception.ErrorDispatcher;
import org.cleanarch.article.api.filter.ErrorPropagationFilter;
import org.cleanarch.article.api.filter.ErrorRecoveryFilter;
import org.cleanarch.article.api.filter.RequestTimeoutFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Duration;

/**
 * Request pipeline: recovery wraps propagation, which wraps the timeout filter and the dispatcher.
 * All of them run inside Boot's observation filter ({@code HIGHEST_PRECEDENCE + 1}) so request
 * metrics see the status the error pipeline wrote.
 */
@Configuration
public class ErrorHandlingConfig {

    static final int CORS_ORDER = Ordered.HIGHEST_PRECEDENCE + 2;
    static final int RECOVERY_ORDER = CORS_ORDER + 1;
    static final int PROPAGATION_ORDER = RECOVERY_ORDER + 1;
    static final int TIMEOUT_ORDER = PROPAGATION_ORDER + 1;

    @Bean
    public FilterRegistrationBean<ErrorRecoveryFilter> errorRecoveryFilter(ErrorDispatcher errorDispatcher) {
        FilterRegistrationBean<ErrorRecoveryFilter> registration =
                new FilterRegistrationBean<>(new ErrorRecoveryFilter(errorDispatcher));
        registration.setOrder(RECOVERY_ORDER);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<ErrorPropagationFilter> errorPropagationFilter(ErrorDispatcher errorDispatcher) {
        FilterRegistrationBean<ErrorPropagationFilter> registration =
                new FilterRegistrationBean<>(new ErrorPropagationFilter(errorDispatcher));
        registration.setOrder(PROPAGATION_ORDER);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RequestTimeoutFilter> requestTimeoutFilter(
            @Value("${app.context.timeout:30s}") Duration timeout) {
        FilterRegistrationBean<RequestTimeoutFilter> registration =
                new FilterRegistrationBean<>(new RequestTimeoutFilter(timeout));
        registration.setOrder(TIMEOUT_ORDER);
        return registration;
    }
}
