package com.warden.guard.web;

import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Installs the {@link OwnershipHandlerInterceptor} on every handler mapping. */
public class OwnershipWebMvcConfigurer implements WebMvcConfigurer {

    private final OwnershipHandlerInterceptor interceptor;

    public OwnershipWebMvcConfigurer(OwnershipHandlerInterceptor interceptor) {
        this.interceptor = interceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(interceptor);
    }
}
