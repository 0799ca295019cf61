package org.cleanarch.article.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cleanarch.article.domain.exception.DomainError;
import org.cleanarch.article.domain.exception.DomainException;
import org.cleanarch.article.domain.model.Article;
import org.cleanarch.article.domain.model.Author;
import org.cleanarch.article.domain.repository.ArticleRepository;
import org.cleanarch.article.domain.repository.AuthorRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Article use cases. Failures are reported as {@link DomainException}s.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleService {

    private final ArticleRepository articleRepository;
    private final AuthorRepository authorRepository;

    /**
     * Articles created strictly after {@code cursor}, oldest first, at most {@code num}.
     * A blank cursor starts from the beginning.
     */
    @Transactional(readOnly = true)
    public ArticlePage fetch(String cursor, int num) {
        if (num <= 0) {
            throw new DomainException(DomainError.BAD_PARAM_INPUT);
        }
        RequestDeadline.checkNotExpired("fetch");

        PageRequest page = PageRequest.of(0, num);
        List<Article> articles = cursor == null || cursor.isBlank()
                ? articleRepository.findAllByOrderByCreatedAtAsc(page)
                : articleRepository.findByCreatedAtAfterOrderByCreatedAtAsc(CursorCodec.decode(cursor), page);

        String nextCursor = articles.isEmpty()
                ? ""
                : CursorCodec.encode(articles.get(articles.size() - 1).getCreatedAt());
        return new ArticlePage(articles, nextCursor);
    }

    @Transactional(readOnly = true)
    public Article getById(long id) {
        RequestDeadline.checkNotExpired("getById");
        return articleRepository.findById(id)
                .orElseThrow(() -> new DomainException(DomainError.NOT_FOUND));
    }

    @Transactional(readOnly = true)
    public Article getByTitle(String title) {
        RequestDeadline.checkNotExpired("getByTitle");
        return articleRepository.findFirstByTitle(title)
                .orElseThrow(() -> new DomainException(DomainError.NOT_FOUND));
    }

    /**
     * Store a new article. Titles are unique.
     */
    @Transactional
    public Article store(Article article) {
        RequestDeadline.checkNotExpired("store");
        if (articleRepository.existsByTitle(article.getTitle())) {
            log.info("Rejected article with existing title: {}", article.getTitle());
            throw new DomainException(DomainError.CONFLICT);
        }
        article.setAuthor(resolveAuthor(article.getAuthor()));

        OffsetDateTime now = OffsetDateTime.now();
        article.setCreatedAt(now);
        article.setUpdatedAt(now);
        Article saved = saveUnique(article);
        log.info("Stored article: id={}", saved.getId());
        return saved;
    }

    /**
     * Replace title, content and author of an existing article. The new title must not belong
     * to another article.
     */
    @Transactional
    public Article update(Article article) {
        RequestDeadline.checkNotExpired("update");
        Article existing = articleRepository.findById(article.getId())
                .orElseThrow(() -> new DomainException(DomainError.NOT_FOUND));
        if (!existing.getTitle().equals(article.getTitle()) && articleRepository.existsByTitle(article.getTitle())) {
            log.info("Rejected rename of article {} to existing title: {}", existing.getId(), article.getTitle());
            throw new DomainException(DomainError.CONFLICT);
        }
        existing.setTitle(article.getTitle());
        existing.setContent(article.getContent());
        existing.setAuthor(resolveAuthor(article.getAuthor()));
        existing.setUpdatedAt(OffsetDateTime.now());
        return saveUnique(existing);
    }

    @Transactional
    public void delete(long id) {
        RequestDeadline.checkNotExpired("delete");
        if (!articleRepository.existsById(id)) {
            throw new DomainException(DomainError.NOT_FOUND);
        }
        articleRepository.deleteById(id);
        log.info("Deleted article: id={}", id);
    }

    // the unique index on title catches a concurrent writer that passed the existsByTitle check
    private Article saveUnique(Article article) {
        try {
            return articleRepository.saveAndFlush(article);
        } catch (DataIntegrityViolationException e) {
            throw new DomainException(DomainError.CONFLICT, e);
        }
    }

    private Author resolveAuthor(Author author) {
        if (author == null || author.getId() == null) {
            return null;
        }
        return authorRepository.findById(author.getId())
                .orElseThrow(() -> new DomainException(DomainError.NOT_FOUND));
    }
}
