package io.springsecurity.requestmap.security.authz.source;

import io.springsecurity.requestmap.admin.repository.RequestmapRepository;
import io.springsecurity.requestmap.security.exception.RuleConfigurationException;
import io.springsecurity.requestmap.security.properties.RequestmapSecurityProperties;
import io.springsecurity.requestmap.security.properties.RuleDefinition;
import io.springsecurity.requestmap.security.properties.SecurityConfigType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * securityConfigType 에 따라 활성 규칙 소스를 구성합니다.
 * <ul>
 *     <li>ANNOTATION: 선언 규칙 + staticRules 를 담은 정적 소스 (주 소스)</li>
 *     <li>MAP: interceptUrlMap + staticRules 를 담은 설정 맵 소스 (주 소스)</li>
 *     <li>REQUESTMAP_INSTANCES: staticRules 정적 소스 (보조) + Requestmap 저장소 소스 (주 소스)</li>
 * </ul>
 */
@Slf4j
public class RuleSourceFactory {

    private final RequestmapSecurityProperties properties;
    private final List<DeclaredRuleProvider> declaredRuleProviders;
    private final RequestmapRepository requestmapRepository;
    private final RuleDefinitionConverter converter;

    public RuleSourceFactory(RequestmapSecurityProperties properties,
                             List<DeclaredRuleProvider> declaredRuleProviders,
                             RequestmapRepository requestmapRepository,
                             RuleDefinitionConverter converter) {
        this.properties = properties;
        this.declaredRuleProviders = declaredRuleProviders == null ? List.of() : declaredRuleProviders;
        this.requestmapRepository = requestmapRepository;
        this.converter = converter;
    }

    public List<RuleSource> createSources() {
        SecurityConfigType type = properties.getSecurityConfigType();
        if (type == null) {
            throw new RuleConfigurationException("securityConfigType must be one of Annotation, Map, RequestmapInstances");
        }
        if (type != SecurityConfigType.MAP && !properties.getInterceptUrlMap().isEmpty()) {
            throw new RuleConfigurationException(String.format(
                    "interceptUrlMap is declared but securityConfigType is %s; only one primary rule source may be enabled", type));
        }

        List<RuleDefinition> declared = collectDeclaredRules();
        if (type != SecurityConfigType.ANNOTATION && !declared.isEmpty()) {
            log.warn("Ignoring {} declared rules because securityConfigType is {}", declared.size(), type);
        }

        List<RuleSource> sources = new ArrayList<>();
        switch (type) {
            case ANNOTATION -> {
                List<RuleDefinition> definitions = new ArrayList<>(declared);
                definitions.addAll(properties.getStaticRules());
                sources.add(new StaticRuleSource(definitions, converter, true));
            }
            case MAP -> {
                List<RuleDefinition> definitions = new ArrayList<>(properties.getInterceptUrlMap());
                definitions.addAll(properties.getStaticRules());
                sources.add(new ConfigMapRuleSource(definitions, converter));
            }
            case REQUESTMAP_INSTANCES -> {
                if (requestmapRepository == null) {
                    throw new RuleConfigurationException(
                            "securityConfigType is RequestmapInstances but no RequestmapRepository is available");
                }
                sources.add(new StaticRuleSource(properties.getStaticRules(), converter, false));
                sources.add(new RequestmapRuleSource(requestmapRepository, converter));
            }
        }
        log.info("Configured rule sources for securityConfigType {}: {}", type,
                sources.stream().map(source -> source.getOrigin() + (source.isPrimary() ? "(primary)" : "")).toList());
        return sources;
    }

    private List<RuleDefinition> collectDeclaredRules() {
        List<RuleDefinition> declared = new ArrayList<>();
        for (DeclaredRuleProvider provider : declaredRuleProviders) {
            List<RuleDefinition> rules = provider.declaredRules();
            if (rules != null) {
                declared.addAll(rules);
            }
        }
        return declared;
    }
}
