package dev.newsjournal.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsjournal.journal.ArticleRef;
import dev.newsjournal.journal.JournalEntry;
import dev.newsjournal.journal.JournalErrorKind;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of a journal operation. Only the fields relevant to the operation are present.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a journal operation")
public class JournalResponse {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    @Schema(description = "Outcome", example = "success", allowableValues = {"success", "error"})
    private String status;

    @Schema(description = "Error kind when status is error",
            example = "OutOfRange",
            allowableValues = {"OutOfRange", "NotFound", "InvalidArgument", "JournalExhausted", "PartialFailure"})
    private String errorKind;

    @Schema(description = "Human-readable detail")
    private String message;

    @Schema(description = "Article number affected by the operation", example = "3")
    private Integer articleNumber;

    @Schema(description = "Single article returned by the operation")
    private ArticleRef article;

    @Schema(description = "Articles read, in reading order")
    private List<ArticleRef> articles;

    @Schema(description = "Journal entries with their current article numbers")
    private List<JournalEntry> entries;

    @Schema(description = "Article number of the next unread article; length + 1 when exhausted", example = "1")
    private Integer cursor;

    @Schema(description = "Number of articles in the journal", example = "5")
    private Integer length;

    @Schema(description = "Total estimated reading time, ISO-8601", example = "PT12M30S")
    private String duration;

    @Schema(description = "Total estimated reading time in seconds", example = "750")
    private Long durationSeconds;

    @Schema(description = "Articles whose read count could not be recorded")
    private List<Long> failedArticleIds;

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public static JournalResponse success() {
        return JournalResponse.builder().status(SUCCESS).build();
    }

    public static JournalResponse error(JournalErrorKind kind, String message) {
        return JournalResponse.builder()
                .status(ERROR)
                .errorKind(kind.wireName())
                .message(message)
                .build();
    }
}
