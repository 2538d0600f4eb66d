package com.corebank.ledger.aspect;

import com.corebank.ledger.exception.CoreBankException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Execution logging for the engine and its HTTP façade.
 *
 * - Services: entry with arguments, outcome, duration; the failure kind is
 *   logged at WARN for expected business failures and ERROR otherwise
 * - Controllers: one line in, one line out
 * - Repositories: DEBUG only, plus a warning for slow queries
 *
 * Nested service calls (the investment engine calling the ledger engine)
 * keep the outermost executionId in the MDC.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    private static final long SLOW_SERVICE_MS = 1000;
    private static final long SLOW_QUERY_MS = 500;
    private static final int MAX_VALUE_LENGTH = 120;

    @Around("execution(public * com.corebank.ledger.service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        boolean outermost = MDC.get("executionId") == null;
        if (outermost) {
            MDC.put("executionId", generateExecutionId());
        }

        log.info("╔══ SERVICE CALL: {} [{}]", call, MDC.get("executionId"));
        if (log.isDebugEnabled()) {
            String[] names = signature.getParameterNames();
            Object[] args = joinPoint.getArgs();
            for (int i = 0; i < args.length; i++) {
                String name = (names != null && i < names.length) ? names[i] : "arg" + i;
                log.debug("║   {} = {}", name, formatValue(args[i]));
            }
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("╚══ ✓ {} completed in {} ms -> {}", call, elapsed, formatValue(result));
            if (elapsed > SLOW_SERVICE_MS) {
                log.warn("⚠ SLOW OPERATION: {} took {} ms", call, elapsed);
            }
            return result;

        } catch (CoreBankException e) {
            log.warn("╚══ ✗ {} failed after {} ms: {} {}",
                    call, System.currentTimeMillis() - startTime, e.getKind(), e.getMessage());
            throw e;

        } catch (Exception e) {
            log.error("╚══ ✗ {} failed after {} ms: {}: {}",
                    call, System.currentTimeMillis() - startTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;

        } finally {
            if (outermost) {
                MDC.remove("executionId");
            }
        }
    }

    @Around("execution(* com.corebank.ledger.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        log.info("→ HTTP REQUEST: {}", call);
        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.info("← HTTP RESPONSE: {} completed in {} ms", call, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            log.info("← HTTP ERROR: {} failed after {} ms - {}",
                    call, System.currentTimeMillis() - startTime, e.getClass().getSimpleName());
            throw e;
        }
    }

    @Around("execution(* com.corebank.ledger.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String call = signature.getDeclaringType().getSimpleName() + "." + signature.getName();

        if (log.isDebugEnabled()) {
            String params = Arrays.stream(joinPoint.getArgs())
                    .map(this::formatValue)
                    .collect(Collectors.joining(", "));
            log.debug("DB CALL: {}({})", call, params);
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long elapsed = System.currentTimeMillis() - startTime;
            if (elapsed > SLOW_QUERY_MS) {
                // lock waits on findByIdForUpdate show up here
                log.warn("⚠ SLOW QUERY: {} took {} ms", call, elapsed);
            }
            return result;
        } catch (Exception e) {
            log.error("DB ERROR: {} - {}: {}", call, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        String text = value.toString();
        if (text.length() > MAX_VALUE_LENGTH) {
            return text.substring(0, MAX_VALUE_LENGTH - 3) + "...";
        }
        return text;
    }

    private String generateExecutionId() {
        return String.format("%d-%d", System.currentTimeMillis(), Thread.currentThread().getId());
    }
}
