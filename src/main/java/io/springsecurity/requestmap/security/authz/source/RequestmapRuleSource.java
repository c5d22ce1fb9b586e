package io.springsecurity.requestmap.security.authz.source;

import io.springsecurity.requestmap.admin.repository.RequestmapRepository;
import io.springsecurity.requestmap.entity.Requestmap;
import io.springsecurity.requestmap.security.authz.rule.AccessRequirement;
import io.springsecurity.requestmap.security.authz.rule.AccessRequirementParser;
import io.springsecurity.requestmap.security.authz.rule.RequestRule;
import io.springsecurity.requestmap.security.authz.rule.RuleOrigin;
import io.springsecurity.requestmap.security.exception.RuleSourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;

/**
 * 데이터베이스의 Requestmap 행을 규칙으로 읽어오는 동적 소스.
 * 외부 변경을 스스로 감지하지 않으므로, 저장소를 변경한 쪽이 커밋 후 캐시 무효화를 호출해야 합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestmapRuleSource implements RuleSource {

    private final RequestmapRepository requestmapRepository;
    private final RuleDefinitionConverter converter;

    @Override
    public List<RequestRule> listRules() {
        List<Requestmap> requestmaps;
        try {
            requestmaps = requestmapRepository.findAllByOrderByIdAsc();
        } catch (DataAccessException e) {
            throw new RuleSourceUnavailableException(getOrigin(), "Requestmap store is unavailable: " + e.getMessage(), e);
        }

        List<RequestRule> rules = new ArrayList<>(requestmaps.size());
        int index = 0;
        for (Requestmap requestmap : requestmaps) {
            String description = RuleDefinitionConverter.describe(getOrigin(), index, requestmap.getUrl())
                    + " [requestmap id=" + requestmap.getId() + "]";
            AccessRequirement requirement =
                    AccessRequirementParser.parseConfigAttribute(requestmap.getConfigAttribute(), description);
            rules.add(converter.convert(requestmap.getUrl(), requestmap.getHttpMethod(), requirement, getOrigin(), index));
            index++;
        }
        log.debug("Loaded {} requestmap rules from store", rules.size());
        return rules;
    }

    @Override
    public boolean supportsLiveInvalidation() {
        return true;
    }

    @Override
    public RuleOrigin getOrigin() {
        return RuleOrigin.DYNAMIC_STORE;
    }

    @Override
    public boolean isPrimary() {
        return true;
    }
}
