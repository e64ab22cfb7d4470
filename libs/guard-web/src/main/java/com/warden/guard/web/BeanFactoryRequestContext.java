package com.warden.guard.web;

import com.warden.guard.RequestContext;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;

/**
 * {@link RequestContext} that resolves services from the Spring {@link BeanFactory}. Request-scoped
 * beans resolve to the instance bound to the current request.
 */
public class BeanFactoryRequestContext implements RequestContext {

    private final BeanFactory beanFactory;

    public BeanFactoryRequestContext(BeanFactory beanFactory) {
        if (beanFactory == null) {
            throw new IllegalArgumentException("beanFactory must not be null");
        }
        this.beanFactory = beanFactory;
    }

    @Override
    public <S> S resolve(Class<S> serviceType) {
        try {
            return beanFactory.getBean(serviceType);
        } catch (BeansException e) {
            throw new IllegalStateException(
                    "Cannot resolve %s for ownership check".formatted(serviceType.getName()), e);
        }
    }
}
