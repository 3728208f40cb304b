package com.copyleft.LetterClash.global.aop;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.util.Arrays;

@Slf4j
@Aspect
@Component
public class LogAspect {

    @Pointcut("execution(public * com.copyleft.LetterClash.feature..*Service.*(..))")
    public void serviceLayer() {}

    @Around("serviceLayer()")
    public Object logExecutionTime(ProceedingJoinPoint joinPoint) throws Throwable {
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String methodName = joinPoint.getSignature().getName();

        if (!log.isDebugEnabled()) {
            return proceedLoggingFailure(joinPoint, className, methodName);
        }

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        log.debug("▶ [START] {}.{} | Args: {}", className, methodName, Arrays.deepToString(joinPoint.getArgs()));

        Object result = null;
        try {
            result = proceedLoggingFailure(joinPoint, className, methodName);
            return result;
        } finally {
            stopWatch.stop();
            log.debug("◀ [END] {}.{} | Result: {} | Time: {}ms",
                    className, methodName, result, stopWatch.getTotalTimeMillis());
        }
    }

    private Object proceedLoggingFailure(ProceedingJoinPoint joinPoint, String className, String methodName) throws Throwable {
        try {
            return joinPoint.proceed();
        } catch (Throwable e) {
            log.error("🛑 [EXCEPTION] {}.{} | Msg: {}", className, methodName, e.getMessage(), e);
            throw e;
        }
    }
}
