package io.springsecurity.requestmap.security.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.springsecurity.requestmap.admin.repository.RequestmapRepository;
import io.springsecurity.requestmap.security.authz.aop.AuthorizationAuditAspect;
import io.springsecurity.requestmap.security.authz.cache.CompiledRuleCache;
import io.springsecurity.requestmap.security.authz.cache.RuleCompiler;
import io.springsecurity.requestmap.security.authz.expression.AccessExpressionEvaluator;
import io.springsecurity.requestmap.security.authz.expression.SpelAccessExpressionEvaluator;
import io.springsecurity.requestmap.security.authz.manager.RequestmapAuthorizationManager;
import io.springsecurity.requestmap.security.authz.matcher.AntPathRuleMatcher;
import io.springsecurity.requestmap.security.authz.monitoring.CompiledRuleCacheHealthIndicator;
import io.springsecurity.requestmap.security.authz.monitoring.PolicyDecisionMetrics;
import io.springsecurity.requestmap.security.authz.resolver.PolicyResolver;
import io.springsecurity.requestmap.security.authz.source.DeclaredRuleProvider;
import io.springsecurity.requestmap.security.authz.source.RuleDefinitionConverter;
import io.springsecurity.requestmap.security.authz.source.RuleSourceFactory;
import io.springsecurity.requestmap.security.properties.RequestmapSecurityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.access.hierarchicalroles.RoleHierarchy;
import org.springframework.security.web.access.expression.DefaultHttpSecurityExpressionHandler;

/**
 * 정책 해석 엔진 구성: 규칙 소스 → 컴파일러 → 캐시 → 리졸버 → 인가 관리자.
 */
@Slf4j
@Configuration
public class RequestmapAuthorizationConfig {

    @Bean
    public AntPathRuleMatcher antPathRuleMatcher() {
        return new AntPathRuleMatcher();
    }

    @Bean
    public RuleSourceFactory ruleSourceFactory(RequestmapSecurityProperties properties,
                                               ObjectProvider<DeclaredRuleProvider> declaredRuleProviders,
                                               ObjectProvider<RequestmapRepository> requestmapRepository,
                                               AntPathRuleMatcher antPathRuleMatcher) {
        return new RuleSourceFactory(properties,
                declaredRuleProviders.orderedStream().toList(),
                requestmapRepository.getIfAvailable(),
                new RuleDefinitionConverter(antPathRuleMatcher));
    }

    @Bean
    public RuleCompiler ruleCompiler(RuleSourceFactory ruleSourceFactory, AntPathRuleMatcher antPathRuleMatcher) {
        return new RuleCompiler(ruleSourceFactory.createSources(), antPathRuleMatcher);
    }

    @Bean
    public CompiledRuleCache compiledRuleCache(RuleCompiler ruleCompiler, MeterRegistry meterRegistry) {
        return new CompiledRuleCache(ruleCompiler, meterRegistry);
    }

    @Bean
    public PolicyResolver policyResolver(CompiledRuleCache compiledRuleCache, AntPathRuleMatcher antPathRuleMatcher,
                                         RequestmapSecurityProperties properties) {
        if (properties.isRejectIfNoRule() && !properties.isRejectPublicInvocations()) {
            log.debug("rejectPublicInvocations=false has no effect while rejectIfNoRule=true");
        }
        return new PolicyResolver(compiledRuleCache, antPathRuleMatcher, properties.toLockdownPolicy());
    }

    @Bean
    public AccessExpressionEvaluator accessExpressionEvaluator(ObjectProvider<RoleHierarchy> roleHierarchy) {
        DefaultHttpSecurityExpressionHandler expressionHandler = new DefaultHttpSecurityExpressionHandler();
        roleHierarchy.ifAvailable(expressionHandler::setRoleHierarchy);
        return new SpelAccessExpressionEvaluator(expressionHandler);
    }

    @Bean
    public PolicyDecisionMetrics policyDecisionMetrics(MeterRegistry meterRegistry) {
        return new PolicyDecisionMetrics(meterRegistry);
    }

    @Bean
    public RequestmapAuthorizationManager requestmapAuthorizationManager(PolicyResolver policyResolver,
                                                                         AccessExpressionEvaluator accessExpressionEvaluator,
                                                                         PolicyDecisionMetrics policyDecisionMetrics) {
        return new RequestmapAuthorizationManager(policyResolver, accessExpressionEvaluator, policyDecisionMetrics);
    }

    @Bean
    public CompiledRuleCacheHealthIndicator requestRulesHealthIndicator(CompiledRuleCache compiledRuleCache) {
        return new CompiledRuleCacheHealthIndicator(compiledRuleCache);
    }

    @Bean
    public AuthorizationAuditAspect authorizationAuditAspect(ObjectMapper objectMapper) {
        return new AuthorizationAuditAspect(objectMapper);
    }
}
