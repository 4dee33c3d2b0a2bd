package com.omniguard.api.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RequestThrottleInterceptor throttleInterceptor;

    public WebConfig(RequestThrottleInterceptor throttleInterceptor) {
        this.throttleInterceptor = throttleInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(throttleInterceptor).addPathPatterns("/api/v1/messages", "/api/v1/messages/**");
    }
}
