package io.springsecurity.requestmap.security.properties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.convert.Delimiter;

import java.util.ArrayList;
import java.util.List;

/**
 * 설정 파일에 선언된 규칙 한 건. access 는 단일 문자열이나 목록 모두 허용합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleDefinition {

    private String pattern;

    // 표현식 안의 콤마가 분리되지 않도록 구분자를 끈다
    @Delimiter(Delimiter.NONE)
    @Builder.Default
    private List<String> access = new ArrayList<>();

    private String httpMethod;

    public static RuleDefinition of(String pattern, String... access) {
        return RuleDefinition.builder()
                .pattern(pattern)
                .access(new ArrayList<>(List.of(access)))
                .build();
    }
}
