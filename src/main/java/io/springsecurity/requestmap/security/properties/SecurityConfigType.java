package io.springsecurity.requestmap.security.properties;

/**
 * 주(primary) 규칙 소스의 종류. 한 번에 하나만 활성화됩니다.
 */
public enum SecurityConfigType {

    /** 컨트롤러 선언(어노테이션)에서 파생된 규칙 */
    ANNOTATION,

    /** 설정 파일의 interceptUrlMap / staticRules */
    MAP,

    /** 데이터베이스에 저장된 Requestmap 인스턴스 */
    REQUESTMAP_INSTANCES
}
