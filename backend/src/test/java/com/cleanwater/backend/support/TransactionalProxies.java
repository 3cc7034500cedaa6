package com.cleanwater.backend.support;

import org.springframework.aop.framework.ProxyFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.AnnotationTransactionAttributeSource;
import org.springframework.transaction.interceptor.MatchAlwaysTransactionAttributeSource;
import org.springframework.transaction.interceptor.TransactionInterceptor;

/**
 * Wraps plain objects in the same transaction interceptors the application context would apply,
 * so unit tests see real commit and rollback decisions.
 */
public final class TransactionalProxies {

    private TransactionalProxies() {
    }

    /** Applies the {@code @Transactional} attributes declared on the service class. */
    @SuppressWarnings("unchecked")
    public static <T> T service(T target, PlatformTransactionManager transactionManager) {
        ProxyFactory factory = new ProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAdvice(new TransactionInterceptor(transactionManager, new AnnotationTransactionAttributeSource()));
        return (T) factory.getProxy();
    }

    /** Every method joins or opens a REQUIRED transaction, as Spring Data repository methods do. */
    @SuppressWarnings("unchecked")
    public static <T> T repository(T target, Class<T> repositoryType, PlatformTransactionManager transactionManager) {
        ProxyFactory factory = new ProxyFactory();
        factory.setTarget(target);
        factory.addInterface(repositoryType);
        factory.addAdvice(new TransactionInterceptor(transactionManager, new MatchAlwaysTransactionAttributeSource()));
        return (T) factory.getProxy();
    }
}
