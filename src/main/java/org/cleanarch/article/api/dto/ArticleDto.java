package org.cleanarch.article.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.cleanarch.article.domain.model.Article;

import java.time.OffsetDateTime;

/**
 * DTO for article responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleDto {

    private Long id;
    private String title;
    private String content;
    private AuthorDto author;

    @JsonProperty("updated_at")
    private OffsetDateTime updatedAt;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    public static ArticleDto from(Article article) {
        return ArticleDto.builder()
                .id(article.getId())
                .title(article.getTitle())
                .content(article.getContent())
                .author(AuthorDto.from(article.getAuthor()))
                .updatedAt(article.getUpdatedAt())
                .createdAt(article.getCreatedAt())
                .build();
    }
}
