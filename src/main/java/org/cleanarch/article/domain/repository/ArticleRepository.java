package org.cleanarch.article.domain.repository;

import org.cleanarch.article.domain.model.Article;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long> {

    List<Article> findAllByOrderByCreatedAtAsc(Pageable pageable);

    List<Article> findByCreatedAtAfterOrderByCreatedAtAsc(OffsetDateTime cursor, Pageable pageable);

    Optional<Article> findFirstByTitle(String title);

    boolean existsByTitle(String title);
}
