package org.cleanarch.article.service;

import org.cleanarch.article.domain.model.Article;

import java.util.List;

/**
 * One page of articles and the cursor for the next one ({@code ""} when the page is empty).
 */
public record ArticlePage(List<Article> articles, String nextCursor) {
}
