package dev.newsjournal.dto;

import dev.newsjournal.journal.ArticleRef;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Article supplied directly by the client. Field rules are checked when the article enters the
 * journal, so violations come back as an {@code InvalidArgument} journal result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Article to append to the journal")
public class ArticleRefRequest {

    @Schema(description = "Catalog id", example = "42")
    private Long id;

    @Schema(description = "Source name", example = "The Daily Planet")
    private String name;

    @Schema(description = "Author", example = "Lois Lane")
    private String author;

    @Schema(description = "Title", example = "Mayor re-elected")
    private String title;

    private String url;

    private String content;

    @Schema(description = "Publication timestamp", example = "2024-05-01T09:30:00")
    private LocalDateTime publishedAt;

    @Schema(description = "Reading time in seconds; estimated from content when absent", example = "240")
    private Integer readingTimeSeconds;

    public ArticleRef toRef() {
        return ArticleRef.builder()
                .id(id)
                .name(name)
                .author(author)
                .title(title)
                .url(url)
                .content(content)
                .publishedAt(publishedAt)
                .readingTime(readingTimeSeconds != null ? Duration.ofSeconds(readingTimeSeconds) : null)
                .build();
    }
}
