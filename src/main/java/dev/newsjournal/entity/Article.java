package dev.newsjournal.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Catalog article row. Journals never hold this entity, only {@link dev.newsjournal.journal.ArticleRef}
 * snapshots of it.
 */
@Table("articles")
@Getter
@Setter
@ToString(exclude = "content")
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    @Id
    private Long id;

    private String name;
    private String author;
    private String title;
    private String url;
    private String content;

    @Column("published_at")
    private LocalDateTime publishedAt;

    @Column("reading_time_seconds")
    private Integer readingTimeSeconds;

    @Column("read_count")
    @Builder.Default
    private Integer readCount = 0;

    @Builder.Default
    private Boolean deleted = false;
}
