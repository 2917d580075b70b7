package dev.newsjournal.controller;

import dev.newsjournal.dto.ArticleKeyRequest;
import dev.newsjournal.dto.ArticleRefRequest;
import dev.newsjournal.dto.JournalResponse;
import dev.newsjournal.dto.MoveRequest;
import dev.newsjournal.dto.SwapRequest;
import dev.newsjournal.service.JournalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller for a session's reading journal.
 * Journal results are returned as-is; the HTTP status reflects the error kind.
 */
@RestController
@RequestMapping("/api/v1/journal")
@RequiredArgsConstructor
@Validated
@Tag(name = "Journal", description = "Queue, reorder and read articles")
@Slf4j
public class JournalController {

    public static final String SESSION_HEADER = "X-Journal-Session";

    private static final String SESSION_ID_REGEX = "^[a-fA-F0-9-]{36}$";
    private static final String SESSION_ID_MESSAGE = "Journal session id must be a UUID";

    private static final Map<String, HttpStatus> STATUS_BY_ERROR_KIND = Map.of(
            "OutOfRange", HttpStatus.BAD_REQUEST,
            "InvalidArgument", HttpStatus.BAD_REQUEST,
            "NotFound", HttpStatus.NOT_FOUND,
            "JournalExhausted", HttpStatus.CONFLICT,
            "PartialFailure", HttpStatus.MULTI_STATUS
    );

    private final JournalService journalService;

    @GetMapping
    @Operation(summary = "List journal entries", description = "Entries with their current article numbers and the cursor")
    public Mono<ResponseEntity<JournalResponse>> listEntries(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId) {
        log.debug("Listing journal entries");
        return journalService.listEntries(sessionId).map(JournalController::toEntity);
    }

    @PostMapping("/articles")
    @Operation(summary = "Append an article", description = "Appends the given article at the end of the journal")
    public Mono<ResponseEntity<JournalResponse>> append(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @RequestBody ArticleRefRequest request) {
        log.info("Appending article id={} to journal", request.getId());
        return journalService.append(sessionId, request).map(JournalController::toCreatedEntity);
    }

    @PostMapping("/articles/catalog/{articleId}")
    @Operation(summary = "Append a catalog article by id")
    public Mono<ResponseEntity<JournalResponse>> appendFromCatalog(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @PathVariable @Min(1) long articleId) {
        log.info("Appending catalog article {} to journal", articleId);
        return journalService.appendFromCatalog(sessionId, articleId).map(JournalController::toCreatedEntity);
    }

    @PostMapping("/articles/catalog")
    @Operation(summary = "Append a catalog article by author, title and publication timestamp")
    public Mono<ResponseEntity<JournalResponse>> appendFromCatalogByKey(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @RequestBody ArticleKeyRequest key) {
        log.info("Appending catalog article '{}' by {} to journal", key.title(), key.author());
        return journalService.appendFromCatalogByKey(sessionId, key).map(JournalController::toCreatedEntity);
    }

    @GetMapping("/articles/{articleNumber}")
    @Operation(summary = "Get the entry at an article number")
    public Mono<ResponseEntity<JournalResponse>> getByArticleNumber(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @PathVariable int articleNumber) {
        return journalService.getByArticleNumber(sessionId, articleNumber).map(JournalController::toEntity);
    }

    @GetMapping("/articles/by-id/{articleId}")
    @Operation(summary = "Get the entry holding an article id")
    public Mono<ResponseEntity<JournalResponse>> getById(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @PathVariable long articleId) {
        return journalService.getById(sessionId, articleId).map(JournalController::toEntity);
    }

    @DeleteMapping("/articles/{articleNumber}")
    @Operation(summary = "Remove the entry at an article number")
    public Mono<ResponseEntity<JournalResponse>> removeByArticleNumber(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @PathVariable int articleNumber) {
        log.info("Removing article number {} from journal", articleNumber);
        return journalService.removeByArticleNumber(sessionId, articleNumber).map(JournalController::toEntity);
    }

    @DeleteMapping("/articles/by-id/{articleId}")
    @Operation(summary = "Remove the first entry holding an article id")
    public Mono<ResponseEntity<JournalResponse>> removeById(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @PathVariable long articleId) {
        log.info("Removing article id {} from journal", articleId);
        return journalService.removeById(sessionId, articleId).map(JournalController::toEntity);
    }

    @DeleteMapping("/articles")
    @Operation(summary = "Remove the first entry matching author, title and publication timestamp")
    public Mono<ResponseEntity<JournalResponse>> removeByKey(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @RequestBody ArticleKeyRequest key) {
        log.info("Removing article '{}' by {} from journal", key.title(), key.author());
        return journalService.removeByKey(sessionId, key).map(JournalController::toEntity);
    }

    @PostMapping("/swap")
    @Operation(summary = "Swap two entries", description = "The cursor keeps its numeric position")
    public Mono<ResponseEntity<JournalResponse>> swap(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @Valid @RequestBody SwapRequest request) {
        log.info("Swapping article numbers {} and {}", request.first(), request.second());
        return journalService.swap(sessionId, request).map(JournalController::toEntity);
    }

    @PostMapping("/move")
    @Operation(summary = "Move an entry to another article number", description = "The cursor follows the entry it pointed at")
    public Mono<ResponseEntity<JournalResponse>> move(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @Valid @RequestBody MoveRequest request) {
        log.info("Moving article number {} to {}", request.from(), request.to());
        return journalService.move(sessionId, request).map(JournalController::toEntity);
    }

    @PostMapping("/articles/{articleNumber}/front")
    @Operation(summary = "Move an entry to the front")
    public Mono<ResponseEntity<JournalResponse>> moveToFront(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @PathVariable int articleNumber) {
        log.info("Moving article number {} to the front", articleNumber);
        return journalService.moveToFront(sessionId, articleNumber).map(JournalController::toEntity);
    }

    @PostMapping("/articles/{articleNumber}/end")
    @Operation(summary = "Move an entry to the end")
    public Mono<ResponseEntity<JournalResponse>> moveToEnd(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @PathVariable int articleNumber) {
        log.info("Moving article number {} to the end", articleNumber);
        return journalService.moveToEnd(sessionId, articleNumber).map(JournalController::toEntity);
    }

    @PostMapping("/clear")
    @Operation(summary = "Remove every entry and reset the cursor")
    public Mono<ResponseEntity<JournalResponse>> clear(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId) {
        log.info("Clearing journal");
        return journalService.clear(sessionId).map(JournalController::toEntity);
    }

    @GetMapping("/current")
    @Operation(summary = "Peek at the current article without reading it")
    public Mono<ResponseEntity<JournalResponse>> getCurrent(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId) {
        return journalService.getCurrent(sessionId).map(JournalController::toEntity);
    }

    @PostMapping("/cursor/{articleNumber}")
    @Operation(summary = "Place the cursor on an article number")
    public Mono<ResponseEntity<JournalResponse>> goTo(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId,
            @PathVariable int articleNumber) {
        log.info("Moving cursor to article number {}", articleNumber);
        return journalService.goTo(sessionId, articleNumber).map(JournalController::toEntity);
    }

    @PostMapping("/read/current")
    @Operation(summary = "Read the current article", description = "Advances the cursor and records a read in the catalog")
    public Mono<ResponseEntity<JournalResponse>> readCurrent(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId) {
        log.info("Reading current article");
        return journalService.readCurrent(sessionId).map(JournalController::toEntity);
    }

    @PostMapping("/read/all")
    @Operation(summary = "Read the entire journal", description = "Rewinds, then reads every article in order")
    public Mono<ResponseEntity<JournalResponse>> readEntireJournal(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId) {
        log.info("Reading entire journal");
        return journalService.readEntireJournal(sessionId).map(JournalController::toEntity);
    }

    @PostMapping("/read/rest")
    @Operation(summary = "Read the rest of the journal", description = "Reads from the current article to the end")
    public Mono<ResponseEntity<JournalResponse>> readRestOfJournal(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId) {
        log.info("Reading rest of journal");
        return journalService.readRestOfJournal(sessionId).map(JournalController::toEntity);
    }

    @PostMapping("/rewind")
    @Operation(summary = "Rewind the cursor to the first article")
    public Mono<ResponseEntity<JournalResponse>> rewind(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId) {
        log.info("Rewinding journal");
        return journalService.rewind(sessionId).map(JournalController::toEntity);
    }

    @GetMapping("/stats")
    @Operation(summary = "Journal length and total estimated reading time")
    public Mono<ResponseEntity<JournalResponse>> stats(
            @RequestHeader(SESSION_HEADER) @Pattern(regexp = SESSION_ID_REGEX, message = SESSION_ID_MESSAGE) String sessionId) {
        return journalService.stats(sessionId).map(JournalController::toEntity);
    }

    static ResponseEntity<JournalResponse> toEntity(JournalResponse response) {
        return ResponseEntity.status(statusOf(response, HttpStatus.OK)).body(response);
    }

    static ResponseEntity<JournalResponse> toCreatedEntity(JournalResponse response) {
        return ResponseEntity.status(statusOf(response, HttpStatus.CREATED)).body(response);
    }

    private static HttpStatus statusOf(JournalResponse response, HttpStatus onSuccess) {
        if (response.isSuccess()) {
            return onSuccess;
        }
        return STATUS_BY_ERROR_KIND.getOrDefault(response.getErrorKind(), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
