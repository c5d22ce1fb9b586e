package io.springsecurity.requestmap.security.authz.aop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.springsecurity.requestmap.security.authz.decision.PolicyDecision;
import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import jakarta.servlet.http.HttpServletRequest;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 정책 판정과 최종 인가 결과를 'authorization-audit' 로거에 JSON 한 줄로 남깁니다.
 */
@Aspect
public class AuthorizationAuditAspect {

    private static final Logger auditLogger = LoggerFactory.getLogger("authorization-audit");

    private final ObjectMapper objectMapper;

    public AuthorizationAuditAspect(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @AfterReturning(pointcut = "execution(* io.springsecurity.requestmap.security.authz.resolver.PolicyResolver.resolve(..))",
            returning = "decision")
    public void logPolicyDecision(JoinPoint joinPoint, PolicyDecision decision) {
        Object[] args = joinPoint.getArgs();
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("timestamp", LocalDateTime.now().toString());
        logData.put("type", "POLICY_DECISION");
        logData.put("method", args.length > 0 ? String.valueOf(args[0]) : null);
        logData.put("path", args.length > 1 ? args[1] : null);
        logData.put("outcome", decision.getOutcome().name());
        logData.put("requirement", decision.isMatched() ? decision.getAccessRequirement().toString() : null);
        logData.put("rule", decision.getMatchedRuleIfAny().map(RequestRule::describe).orElse(null));
        write(logData);
    }

    @AfterReturning(pointcut = "execution(* io.springsecurity.requestmap.security.authz.manager.RequestmapAuthorizationManager.check(..))",
            returning = "decision")
    public void logAuthorizationResult(JoinPoint joinPoint, AuthorizationDecision decision) {
        Object[] args = joinPoint.getArgs();
        if (args.length > 1 && args[1] instanceof RequestAuthorizationContext ctx) {
            HttpServletRequest request = ctx.getRequest();
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("timestamp", LocalDateTime.now().toString());
            logData.put("type", "AUTH_RESULT");
            logData.put("principal", getPrincipalName(args[0]));
            logData.put("uri", request.getRequestURI());
            logData.put("method", request.getMethod());
            logData.put("remoteIp", request.getRemoteAddr());
            logData.put("granted", decision != null && decision.isGranted());
            write(logData);
        }
    }

    private void write(Map<String, Object> logData) {
        try {
            auditLogger.info(objectMapper.writeValueAsString(logData));
        } catch (JsonProcessingException e) {
            auditLogger.error("Failed to write audit log as JSON", e);
        }
    }

    private String getPrincipalName(Object authSupplier) {
        if (authSupplier instanceof Supplier<?> supplier && supplier.get() instanceof Authentication auth) {
            return auth.getName();
        }
        return "anonymous";
    }
}
