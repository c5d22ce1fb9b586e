package io.springsecurity.requestmap.admin.repository;

import io.springsecurity.requestmap.entity.Requestmap;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RequestmapRepository extends JpaRepository<Requestmap, Long> {

    /**
     * 등록 순서(id 오름차순)대로 모든 Requestmap 을 조회합니다.
     * 규칙 컴파일 시 명시도가 같은 규칙 사이의 순서가 이 순서를 따릅니다.
     */
    List<Requestmap> findAllByOrderByIdAsc();

    Optional<Requestmap> findByUrlAndHttpMethod(String url, String httpMethod);

    Optional<Requestmap> findByUrlAndHttpMethodIsNull(String url);
}
