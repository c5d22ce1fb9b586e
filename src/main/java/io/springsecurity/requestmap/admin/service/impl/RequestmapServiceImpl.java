package io.springsecurity.requestmap.admin.service.impl;

import io.springsecurity.requestmap.admin.repository.RequestmapRepository;
import io.springsecurity.requestmap.admin.service.RequestmapService;
import io.springsecurity.requestmap.entity.Requestmap;
import io.springsecurity.requestmap.security.authz.matcher.AntPathRuleMatcher;
import io.springsecurity.requestmap.security.authz.resolver.PolicyResolver;
import io.springsecurity.requestmap.security.authz.rule.AccessRequirementParser;
import io.springsecurity.requestmap.security.authz.source.RuleDefinitionConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RequestmapServiceImpl implements RequestmapService {

    private final RequestmapRepository requestmapRepository;
    private final PolicyResolver policyResolver;
    private final AntPathRuleMatcher antPathRuleMatcher;

    @Override
    @Transactional(readOnly = true)
    public Requestmap getRequestmap(long id) {
        return requestmapRepository.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Requestmap not found with ID: " + id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Requestmap> getRequestmaps() {
        return requestmapRepository.findAllByOrderByIdAsc();
    }

    /**
     * 새 Requestmap 을 저장합니다. URL 은 소문자, HTTP 메서드는 대문자로 정규화한 뒤 검증하며,
     * 커밋이 끝난 뒤 규칙 캐시를 무효화합니다. 인자로 받은 객체는 변경하지 않습니다.
     */
    @Override
    @Transactional
    public Requestmap createRequestmap(Requestmap requestmap) {
        Requestmap candidate = normalize(requestmap);
        validate(candidate);
        if (findDuplicate(candidate).isPresent()) {
            throw new IllegalArgumentException("Requestmap with this URL and HTTP method already exists.");
        }

        Requestmap saved = requestmapRepository.save(candidate);
        clearCachedRulesAfterCommit();
        log.info("Created Requestmap {} {} -> {}", saved.getHttpMethod(), saved.getUrl(), saved.getConfigAttribute());
        return saved;
    }

    @Override
    @Transactional
    public Requestmap updateRequestmap(Requestmap requestmap) {
        Requestmap existing = requestmapRepository.findById(requestmap.getId())
                .orElseThrow(() -> new IllegalArgumentException("Requestmap not found with ID: " + requestmap.getId()));
        Requestmap candidate = normalize(requestmap);
        validate(candidate);
        Optional<Requestmap> duplicate = findDuplicate(candidate);
        if (duplicate.isPresent() && !duplicate.get().getId().equals(existing.getId())) {
            throw new IllegalArgumentException("Requestmap with this URL and HTTP method already exists.");
        }

        existing.setUrl(candidate.getUrl());
        existing.setConfigAttribute(candidate.getConfigAttribute());
        existing.setHttpMethod(candidate.getHttpMethod());
        requestmapRepository.save(existing);

        clearCachedRulesAfterCommit();
        log.info("Updated Requestmap ID {}: {} {} -> {}", existing.getId(), existing.getHttpMethod(),
                existing.getUrl(), existing.getConfigAttribute());
        return existing;
    }

    @Override
    @Transactional
    public void deleteRequestmap(long id) {
        requestmapRepository.deleteById(id);
        clearCachedRulesAfterCommit();
        log.info("Deleted Requestmap ID {}", id);
    }

    // 저장소 규칙 소스는 패턴을 소문자로 읽으므로 저장과 중복 검사도 같은 형태를 쓴다
    private Requestmap normalize(Requestmap requestmap) {
        String url = requestmap.getUrl() == null ? null : requestmap.getUrl().toLowerCase(Locale.ROOT);
        String httpMethod = StringUtils.hasText(requestmap.getHttpMethod())
                ? requestmap.getHttpMethod().trim().toUpperCase(Locale.ROOT)
                : null;
        return Requestmap.builder()
                .id(requestmap.getId())
                .url(url)
                .configAttribute(requestmap.getConfigAttribute())
                .httpMethod(httpMethod)
                .build();
    }

    private void validate(Requestmap requestmap) {
        String description = "requestmap " + requestmap.getUrl();
        antPathRuleMatcher.validate(requestmap.getUrl(), description);
        RuleDefinitionConverter.parseHttpMethod(requestmap.getHttpMethod(), description);
        AccessRequirementParser.parseConfigAttribute(requestmap.getConfigAttribute(), description);
    }

    private Optional<Requestmap> findDuplicate(Requestmap requestmap) {
        if (requestmap.getHttpMethod() == null) {
            return requestmapRepository.findByUrlAndHttpMethodIsNull(requestmap.getUrl());
        }
        return requestmapRepository.findByUrlAndHttpMethod(requestmap.getUrl(), requestmap.getHttpMethod());
    }

    // 커밋 전에 무효화하면 재빌드가 이전 데이터를 읽을 수 있다
    private void clearCachedRulesAfterCommit() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    policyResolver.clearCachedRules();
                }
            });
        } else {
            policyResolver.clearCachedRules();
        }
    }
}
