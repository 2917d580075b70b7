package dev.newsjournal.journal;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

/**
 * A user's ordered reading queue plus the cursor pointing at the next unread article.
 *
 * <p>Article numbers are 1-based and derived from list position, so after any insert,
 * removal, swap or move they are again exactly {@code 1..length()}. The cursor always lies in
 * {@code [1, length() + 1]}; {@code length() + 1} means every article has been read.</p>
 *
 * <p>Cursor rules differ per operation:</p>
 * <ul>
 *   <li>{@link #swap(int, int)} is slot-based: the cursor keeps its numeric value.</li>
 *   <li>{@link #moveToPosition(int, int)} is content-based: the cursor follows the entry it addressed.</li>
 *   <li>removal shifts the cursor down only when the removed entry was before it.</li>
 * </ul>
 *
 * <p>Not thread-safe. Callers serialize access, one journal per session.</p>
 */
@Slf4j
public class Journal {

    private final List<ArticleRef> articles = new ArrayList<>();
    private final boolean allowDuplicates;
    private int cursor = 1;

    public Journal() {
        this(false);
    }

    /**
     * @param allowDuplicates whether the same article id may be appended more than once
     */
    public Journal(boolean allowDuplicates) {
        this.allowDuplicates = allowDuplicates;
    }

    // ==================== Article management ====================

    /**
     * Appends an article at the end of the journal.
     *
     * @return the article number of the new entry
     */
    public int append(ArticleRef ref) {
        ArticleRef.validate(ref);
        if (!allowDuplicates && indexOfId(ref.getId()) >= 0) {
            log.warn("Article with id {} already exists in the journal", ref.getId());
            throw JournalException.invalidArgument("Article with id " + ref.getId() + " already exists in the journal");
        }
        articles.add(ref);
        log.info("Appended article {} ({}) as article number {}", ref.getId(), ref.getTitle(), articles.size());
        return articles.size();
    }

    public ArticleRef removeByArticleNumber(int articleNumber) {
        int number = validateArticleNumber(articleNumber);
        ArticleRef removed = articles.remove(number - 1);
        if (cursor > number) {
            cursor--;
        }
        log.info("Removed article {} ({}) at article number {}, cursor now {}",
                removed.getId(), removed.getTitle(), number, cursor);
        return removed;
    }

    public ArticleRef removeById(long articleId) {
        return removeByArticleNumber(articleNumberOfId(articleId));
    }

    public ArticleRef removeByKey(String author, String title, LocalDateTime publishedAt) {
        return removeByArticleNumber(articleNumberOfKey(author, title, publishedAt));
    }

    /**
     * Exchanges the entries at two article numbers. The cursor keeps pointing at the same slot.
     */
    public void swap(int first, int second) {
        int a = validateArticleNumber(first);
        int b = validateArticleNumber(second);
        if (a == b) {
            log.warn("Cannot swap article number {} with itself", a);
            throw JournalException.invalidArgument("Cannot swap an article with itself: article number " + a);
        }
        Collections.swap(articles, a - 1, b - 1);
        log.info("Swapped article numbers {} and {}", a, b);
    }

    /**
     * Moves the entry at {@code from} to {@code to}, shifting the entries in between by one.
     * The cursor keeps addressing the entry it addressed before the move.
     */
    public void moveToPosition(int from, int to) {
        int source = validateArticleNumber(from);
        int target = validateArticleNumber(to);
        if (source == target) {
            return;
        }
        ArticleRef moved = articles.remove(source - 1);
        articles.add(target - 1, moved);

        int previousCursor = cursor;
        if (cursor == source) {
            cursor = target;
        } else if (source < cursor && cursor <= target) {
            cursor--;
        } else if (target <= cursor && cursor < source) {
            cursor++;
        }
        log.info("Moved article {} from article number {} to {}, cursor {} -> {}",
                moved.getId(), source, target, previousCursor, cursor);
    }

    public void moveToFront(int articleNumber) {
        moveToPosition(articleNumber, 1);
    }

    public void moveToEnd(int articleNumber) {
        moveToPosition(articleNumber, articles.size());
    }

    public void clear() {
        if (articles.isEmpty()) {
            log.warn("Clearing an empty journal");
        }
        articles.clear();
        cursor = 1;
        log.info("Journal cleared");
    }

    // ==================== Retrieval ====================

    public List<JournalEntry> entries() {
        return IntStream.range(0, articles.size())
                .mapToObj(i -> new JournalEntry(i + 1, articles.get(i)))
                .toList();
    }

    public JournalEntry entryAt(int articleNumber) {
        int number = validateArticleNumber(articleNumber);
        return new JournalEntry(number, articles.get(number - 1));
    }

    public JournalEntry findById(long articleId) {
        return entryAt(articleNumberOfId(articleId));
    }

    /**
     * The entry the cursor points at, without reading it.
     */
    public JournalEntry current() {
        if (isExhausted()) {
            throw JournalException.exhausted(exhaustedMessage());
        }
        return new JournalEntry(cursor, articles.get(cursor - 1));
    }

    /**
     * Places the cursor on the given article number.
     */
    public void goTo(int articleNumber) {
        int number = validateArticleNumber(articleNumber);
        log.info("Setting current article number from {} to {}", cursor, number);
        cursor = number;
    }

    public int articleNumberOfId(long articleId) {
        int index = indexOfId(articleId);
        if (index < 0) {
            log.warn("Article with id {} not found in journal", articleId);
            throw JournalException.notFound("Article with id " + articleId + " not found in journal");
        }
        return index + 1;
    }

    public int articleNumberOfKey(String author, String title, LocalDateTime publishedAt) {
        for (int i = 0; i < articles.size(); i++) {
            if (articles.get(i).matchesKey(author, title, publishedAt)) {
                return i + 1;
            }
        }
        log.warn("Article '{}' by {} ({}) not found in journal", title, author, publishedAt);
        throw JournalException.notFound("Article '" + title + "' by " + author + " (" + publishedAt + ") not found in journal");
    }

    public int length() {
        return articles.size();
    }

    public boolean isEmpty() {
        return articles.isEmpty();
    }

    public int cursor() {
        return cursor;
    }

    public boolean isExhausted() {
        return cursor > articles.size();
    }

    public boolean isAllowDuplicates() {
        return allowDuplicates;
    }

    // ==================== Cursor primitives used by ReadTracker ====================

    ArticleRef advance() {
        ArticleRef article = current().article();
        cursor++;
        return article;
    }

    void resetCursor() {
        cursor = 1;
    }

    String exhaustedMessage() {
        return articles.isEmpty()
                ? "Journal is empty"
                : "Journal exhausted: all " + articles.size() + " articles have been read";
    }

    private int indexOfId(long articleId) {
        for (int i = 0; i < articles.size(); i++) {
            if (articles.get(i).getId() == articleId) {
                return i;
            }
        }
        return -1;
    }

    private int validateArticleNumber(int articleNumber) {
        if (articleNumber < 1 || articleNumber > articles.size()) {
            log.warn("Invalid article number {} for journal of length {}", articleNumber, articles.size());
            throw JournalException.outOfRange(
                    "Invalid article number: " + articleNumber + " (journal length " + articles.size() + ")");
        }
        return articleNumber;
    }
}
