package io.springsecurity.requestmap.admin.service.impl;

import io.springsecurity.requestmap.admin.repository.RequestmapRepository;
import io.springsecurity.requestmap.entity.Requestmap;
import io.springsecurity.requestmap.security.authz.matcher.AntPathRuleMatcher;
import io.springsecurity.requestmap.security.authz.resolver.PolicyResolver;
import io.springsecurity.requestmap.security.exception.InvalidRulePatternException;
import io.springsecurity.requestmap.security.exception.RuleConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RequestmapServiceImplTest {

    @Mock
    private RequestmapRepository requestmapRepository;

    @Mock
    private PolicyResolver policyResolver;

    private RequestmapServiceImpl requestmapService;

    @BeforeEach
    void setUp() {
        requestmapService = new RequestmapServiceImpl(requestmapRepository, policyResolver, new AntPathRuleMatcher());
    }

    @Test
    @DisplayName("생성 후 규칙 캐시를 무효화하고 HTTP 메서드를 대문자로 정규화한다")
    void createInvalidatesCache() {
        Requestmap requestmap = Requestmap.builder().url("/reports/**").configAttribute("ROLE_AUDITOR").httpMethod("get").build();
        when(requestmapRepository.findByUrlAndHttpMethod("/reports/**", "GET")).thenReturn(Optional.empty());
        when(requestmapRepository.save(any(Requestmap.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Requestmap saved = requestmapService.createRequestmap(requestmap);

        assertThat(saved.getHttpMethod()).isEqualTo("GET");
        verify(policyResolver).clearCachedRules();
    }

    @Test
    @DisplayName("잘못된 패턴은 저장 전에 거부되고 캐시는 건드리지 않는다")
    void invalidPatternRejectedBeforeSave() {
        Requestmap requestmap = Requestmap.builder().url("reports/**").configAttribute("ROLE_AUDITOR").build();

        assertThatThrownBy(() -> requestmapService.createRequestmap(requestmap))
                .isInstanceOf(InvalidRulePatternException.class);
        verify(requestmapRepository, never()).save(any());
        verify(policyResolver, never()).clearCachedRules();
    }

    @Test
    @DisplayName("표현식과 권한을 섞은 configAttribute 는 거부된다")
    void invalidConfigAttributeRejected() {
        Requestmap requestmap = Requestmap.builder().url("/reports/**").configAttribute("ROLE_A,isAuthenticated()").build();

        assertThatThrownBy(() -> requestmapService.createRequestmap(requestmap))
                .isInstanceOf(RuleConfigurationException.class);
        verify(requestmapRepository, never()).save(any());
    }

    @Test
    @DisplayName("같은 URL/메서드 조합이 이미 있으면 거부된다")
    void duplicateRejected() {
        Requestmap requestmap = Requestmap.builder().url("/reports/**").configAttribute("ROLE_AUDITOR").build();
        when(requestmapRepository.findByUrlAndHttpMethodIsNull("/reports/**"))
                .thenReturn(Optional.of(Requestmap.builder().id(3L).url("/reports/**").build()));

        assertThatThrownBy(() -> requestmapService.createRequestmap(requestmap))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    @DisplayName("대소문자만 다른 URL 은 같은 규칙으로 보고 중복으로 거부된다")
    void caseVariantDuplicateRejected() {
        when(requestmapRepository.findByUrlAndHttpMethodIsNull("/reports/**"))
                .thenReturn(Optional.of(Requestmap.builder().id(1L).url("/reports/**").configAttribute("ROLE_ADMIN").build()));

        assertThatThrownBy(() -> requestmapService.createRequestmap(
                Requestmap.builder().url("/Reports/**").configAttribute("ROLE_USER").build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");
        verify(requestmapRepository, never()).save(any());
    }

    @Test
    @DisplayName("저장되는 URL 은 소문자로 정규화되고 인자로 받은 객체는 바뀌지 않는다")
    void storesLowercaseUrlWithoutMutatingArgument() {
        Requestmap requestmap = Requestmap.builder().url("/Reports/Daily/**").configAttribute("ROLE_AUDITOR").httpMethod(" get ").build();
        when(requestmapRepository.findByUrlAndHttpMethod("/reports/daily/**", "GET")).thenReturn(Optional.empty());
        when(requestmapRepository.save(any(Requestmap.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Requestmap saved = requestmapService.createRequestmap(requestmap);

        assertThat(saved.getUrl()).isEqualTo("/reports/daily/**");
        assertThat(saved.getHttpMethod()).isEqualTo("GET");
        assertThat(requestmap.getUrl()).isEqualTo("/Reports/Daily/**");
        assertThat(requestmap.getHttpMethod()).isEqualTo(" get ");
    }

    @Test
    @DisplayName("수정 후 기존 엔티티에 값을 반영하고 캐시를 무효화한다")
    void updateCopiesFieldsAndInvalidates() {
        Requestmap existing = Requestmap.builder().id(1L).url("/reports/**").configAttribute("ROLE_AUDITOR").build();
        when(requestmapRepository.findById(1L)).thenReturn(Optional.of(existing));
        when(requestmapRepository.findByUrlAndHttpMethod("/reports/**", "POST")).thenReturn(Optional.empty());

        Requestmap changes = Requestmap.builder().id(1L).url("/reports/**").configAttribute("isFullyAuthenticated()").httpMethod("post").build();
        Requestmap updated = requestmapService.updateRequestmap(changes);

        assertThat(updated).isSameAs(existing);
        assertThat(existing.getConfigAttribute()).isEqualTo("isFullyAuthenticated()");
        assertThat(existing.getHttpMethod()).isEqualTo("POST");
        assertThat(changes.getHttpMethod()).isEqualTo("post");
        verify(requestmapRepository).save(existing);
        verify(policyResolver).clearCachedRules();
    }

    @Test
    @DisplayName("삭제 후 캐시를 무효화한다")
    void deleteInvalidates() {
        requestmapService.deleteRequestmap(7L);

        verify(requestmapRepository).deleteById(7L);
        verify(policyResolver).clearCachedRules();
    }

    @Test
    @DisplayName("없는 ID 조회는 예외")
    void missingIdThrows() {
        when(requestmapRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> requestmapService.getRequestmap(99L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("99");
    }
}
