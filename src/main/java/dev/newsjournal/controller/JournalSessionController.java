package dev.newsjournal.controller;

import dev.newsjournal.dto.SessionResponse;
import dev.newsjournal.exception.ResourceNotFoundException;
import dev.newsjournal.service.JournalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Opens and closes journal sessions. Each session owns exactly one journal.
 */
@RestController
@RequestMapping("/api/v1/journal/sessions")
@RequiredArgsConstructor
@Validated
@Tag(name = "Journal sessions", description = "Journal session lifecycle")
@Slf4j
public class JournalSessionController {

    private final JournalService journalService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Open a session", description = "Creates an empty journal and returns its session id")
    public Mono<SessionResponse> openSession() {
        log.info("Opening journal session");
        return journalService.openSession();
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Close a session", description = "Discards the session's journal")
    public Mono<Void> closeSession(@PathVariable @Size(min = 1, max = 64) String sessionId) {
        log.info("Closing journal session");
        return journalService.closeSession(sessionId)
                .flatMap(closed -> closed
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResourceNotFoundException("error.session_not_found")));
    }
}
