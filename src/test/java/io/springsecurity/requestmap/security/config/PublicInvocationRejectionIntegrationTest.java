package io.springsecurity.requestmap.security.config;

import io.springsecurity.requestmap.security.exception.NoRuleConfiguredException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "security.requestmap.security-config-type=map",
        "security.requestmap.reject-if-no-rule=false",
        "security.requestmap.reject-public-invocations=true",
        "security.requestmap.intercept-url-map[0].pattern=/admin/**",
        "security.requestmap.intercept-url-map[0].access[0]=ROLE_ADMIN"
})
@AutoConfigureMockMvc
class PublicInvocationRejectionIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @WithMockUser(roles = "ADMIN")
    @DisplayName("규칙이 없는 경로는 403 이 아니라 설정 오류 예외로 필터 체인을 빠져나온다")
    void unmappedPathIsConfigurationError() {
        Throwable thrown = catchThrowable(() -> mockMvc.perform(get("/unmapped/resource")));

        assertThat(thrown).isNotNull();
        assertThat(NestedExceptionUtils.getMostSpecificCause(thrown))
                .isInstanceOf(NoRuleConfiguredException.class)
                .hasMessageContaining("/unmapped/resource");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    @DisplayName("규칙이 있는 경로는 평소처럼 인가된다")
    void mappedPathStillAuthorized() throws Exception {
        mockMvc.perform(get("/admin/users"))
                .andExpect(status().isNotFound());
    }
}
