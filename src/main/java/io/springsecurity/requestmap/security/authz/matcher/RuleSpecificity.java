package io.springsecurity.requestmap.security.authz.matcher;

import java.util.Comparator;

/**
 * 패턴의 명시도. 정렬 시 더 명시적인 패턴이 앞에 옵니다.
 * (a) 리터럴 접두어가 길수록, (b) 와일드카드 세그먼트가 적을수록 앞.
 */
public record RuleSpecificity(int literalPrefixLength, int wildcardSegments) implements Comparable<RuleSpecificity> {

    private static final Comparator<RuleSpecificity> ORDER = Comparator
            .comparingInt(RuleSpecificity::literalPrefixLength).reversed()
            .thenComparingInt(RuleSpecificity::wildcardSegments);

    @Override
    public int compareTo(RuleSpecificity other) {
        return ORDER.compare(this, other);
    }
}
