package com.corebank.ledger.aspect;

import com.corebank.ledger.exception.CoreBankException;
import com.corebank.ledger.exception.StoreFailureException;
import jakarta.persistence.PersistenceException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Turns persistence failures escaping a service call into StoreFailureException.
 *
 * Ordered ahead of the transaction interceptor so it also sees failures raised
 * on commit (lock timeouts, unique-key races, lost connections). By the time it
 * runs the unit of work has already been rolled back.
 */
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StoreFailureTranslationAspect {

    private static final Logger log = LoggerFactory.getLogger(StoreFailureTranslationAspect.class);

    @Around("execution(public * com.corebank.ledger.service..*(..))")
    public Object translate(ProceedingJoinPoint joinPoint) throws Throwable {
        try {
            return joinPoint.proceed();
        } catch (CoreBankException e) {
            throw e;
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            log.error("Store failure in {}: {}", joinPoint.getSignature().toShortString(), e.getMessage());
            throw new StoreFailureException("Persistence failure: " + e.getMessage(), e);
        }
    }
}
