package org.cleanarch.article.api.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cleanarch.article.api.dto.ArticleDto;
import org.cleanarch.article.api.dto.ArticleRequest;
import org.cleanarch.article.api.exception.AppError;
import org.cleanarch.article.api.exception.ErrorClassifier;
import org.cleanarch.article.api.exception.RequestErrors;
import org.cleanarch.article.domain.exception.DomainException;
import org.cleanarch.article.domain.model.Article;
import org.cleanarch.article.domain.model.Author;
import org.cleanarch.article.service.ArticlePage;
import org.cleanarch.article.service.ArticleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * CRUD endpoints for articles.
 * <p>
 * Service failures are attached to the request rather than thrown; the error propagation filter
 * writes the response. Handlers return {@code null} in that case so nothing is written here.
 */
@RestController
@RequestMapping("/api/v1/articles")
@RequiredArgsConstructor
@Slf4j
public class ArticleController {

    static final int DEFAULT_NUM = 10;
    static final String CURSOR_HEADER = "X-Cursor";

    private final ArticleService articleService;

    @GetMapping
    public ResponseEntity<List<ArticleDto>> fetchArticles(
            @RequestParam(required = false) String num,
            @RequestParam(defaultValue = "") String cursor,
            HttpServletRequest request) {
        try {
            ArticlePage page = articleService.fetch(cursor, parseNum(num));
            List<ArticleDto> body = page.articles().stream().map(ArticleDto::from).toList();
            return ResponseEntity.ok()
                    .header(CURSOR_HEADER, page.nextCursor())
                    .body(body);
        } catch (DomainException ex) {
            return fail(request, "获取文章列表失败", ex);
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<ArticleDto> getById(@PathVariable long id, HttpServletRequest request) {
        try {
            return ResponseEntity.ok(ArticleDto.from(articleService.getById(id)));
        } catch (DomainException ex) {
            return fail(request, "获取文章失败", ex);
        }
    }

    @PostMapping
    public ResponseEntity<ArticleDto> store(@Valid @RequestBody ArticleRequest body, HttpServletRequest request) {
        try {
            Article stored = articleService.store(toArticle(null, body));
            return ResponseEntity.status(HttpStatus.CREATED).body(ArticleDto.from(stored));
        } catch (DomainException ex) {
            return fail(request, "创建文章失败", ex);
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<ArticleDto> update(@PathVariable long id,
                                             @Valid @RequestBody ArticleRequest body,
                                             HttpServletRequest request) {
        try {
            Article updated = articleService.update(toArticle(id, body));
            log.info("Updated article: id={}", id);
            return ResponseEntity.ok(ArticleDto.from(updated));
        } catch (DomainException ex) {
            return fail(request, "更新文章失败", ex);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable long id, HttpServletRequest request) {
        try {
            articleService.delete(id);
            return ResponseEntity.noContent().build();
        } catch (DomainException ex) {
            return fail(request, "删除文章失败", ex);
        }
    }

    static int parseNum(String num) {
        if (num == null) {
            return DEFAULT_NUM;
        }
        try {
            int parsed = Integer.parseInt(num.trim());
            return parsed > 0 ? parsed : DEFAULT_NUM;
        } catch (NumberFormatException e) {
            return DEFAULT_NUM;
        }
    }

    private static Article toArticle(Long id, ArticleRequest body) {
        return Article.builder()
                .id(id)
                .title(body.getTitle())
                .content(body.getContent())
                .author(body.getAuthorId() == null ? null : Author.builder().id(body.getAuthorId()).build())
                .build();
    }

    private static <T> ResponseEntity<T> fail(HttpServletRequest request, String message, DomainException ex) {
        RequestErrors.attach(request, AppError.withCause(ErrorClassifier.statusOf(ex.getError()), message, ex));
        return null;
    }
}
