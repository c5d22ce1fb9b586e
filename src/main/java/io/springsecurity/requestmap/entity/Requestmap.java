package io.springsecurity.requestmap.entity;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;

/**
 * 데이터베이스에 저장되는 동적 인가 규칙.
 * configAttribute 에는 콤마로 구분된 권한 목록이나 단일 SpEL 표현식이 들어갑니다.
 */
@Entity
@Table(name = "REQUESTMAP",
        uniqueConstraints = @UniqueConstraint(name = "uk_requestmap_url_method", columnNames = {"url", "http_method"}))
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Requestmap implements Serializable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "requestmap_id")
    private Long id;

    @Column(name = "url", nullable = false)
    private String url;

    @Column(name = "config_attribute", nullable = false, length = 1024)
    private String configAttribute;

    @Column(name = "http_method")
    private String httpMethod;
}
