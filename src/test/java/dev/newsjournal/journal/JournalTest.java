package dev.newsjournal.journal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Journal")
class JournalTest {

    private Journal journal;
    private ArticleRef a;
    private ArticleRef b;
    private ArticleRef c;

    @BeforeEach
    void setUp() {
        journal = new Journal();
        a = article(1, "Alpha");
        b = article(2, "Bravo");
        c = article(3, "Charlie");
    }

    static ArticleRef article(long id, String title) {
        return ArticleRef.builder()
                .id(id)
                .name("The Daily Planet")
                .author("Author " + id)
                .title(title)
                .url("https://example.com/" + id)
                .content("Some words about " + title)
                .publishedAt(LocalDateTime.of(2024, 1, (int) id, 9, 0))
                .build();
    }

    private void fill(ArticleRef... refs) {
        for (ArticleRef ref : refs) {
            journal.append(ref);
        }
    }

    private List<Long> ids() {
        return journal.entries().stream().map(e -> e.article().getId()).toList();
    }

    private void assertContiguousNumbers() {
        List<Integer> numbers = journal.entries().stream().map(JournalEntry::articleNumber).toList();
        List<Integer> expected = java.util.stream.IntStream.rangeClosed(1, journal.length()).boxed().toList();
        assertThat(numbers).isEqualTo(expected);
        assertThat(journal.cursor()).isBetween(1, journal.length() + 1);
    }

    private static void assertKind(Runnable action, JournalErrorKind kind) {
        assertThatThrownBy(action::run)
                .isInstanceOf(JournalException.class)
                .extracting(ex -> ((JournalException) ex).getKind())
                .isEqualTo(kind);
    }

    // ==================== append ====================

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("Should append at the end and return the new article number")
        void shouldAppendAtEnd() {
            assertThat(journal.append(a)).isEqualTo(1);
            assertThat(journal.append(b)).isEqualTo(2);

            assertThat(ids()).containsExactly(1L, 2L);
            assertThat(journal.length()).isEqualTo(2);
            assertThat(journal.isEmpty()).isFalse();
        }

        @Test
        @DisplayName("Should leave the cursor unchanged")
        void shouldLeaveCursorUnchanged() {
            fill(a, b);
            journal.goTo(2);

            journal.append(c);

            assertThat(journal.cursor()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should reject a duplicate article id by default")
        void shouldRejectDuplicate() {
            journal.append(a);

            assertKind(() -> journal.append(a), JournalErrorKind.INVALID_ARGUMENT);
            assertThat(journal.length()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should accept duplicates when configured to")
        void shouldAcceptDuplicatesWhenAllowed() {
            Journal permissive = new Journal(true);
            permissive.append(a);
            permissive.append(b);
            permissive.append(a);

            assertThat(permissive.length()).isEqualTo(3);
            assertThat(permissive.articleNumberOfId(1)).isEqualTo(1);
            assertThat(permissive.isAllowDuplicates()).isTrue();
        }

        @Test
        @DisplayName("Should reject an article without title")
        void shouldRejectMissingTitle() {
            ArticleRef untitled = a.toBuilder().title(" ").build();

            assertKind(() -> journal.append(untitled), JournalErrorKind.INVALID_ARGUMENT);
            assertThat(journal.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Should reject null")
        void shouldRejectNull() {
            assertKind(() -> journal.append(null), JournalErrorKind.INVALID_ARGUMENT);
        }
    }

    // ==================== removal ====================

    @Nested
    @DisplayName("removeByArticleNumber")
    class RemoveByArticleNumber {

        @Test
        @DisplayName("Should remove the middle entry and renumber, cursor before it unchanged")
        void shouldRemoveMiddleEntry() {
            fill(a, b, c);

            ArticleRef removed = journal.removeByArticleNumber(2);

            assertThat(removed).isEqualTo(b);
            assertThat(ids()).containsExactly(1L, 3L);
            assertThat(journal.cursor()).isEqualTo(1);
            assertThat(journal.entries()).extracting(JournalEntry::articleNumber).containsExactly(1, 2);
        }

        @Test
        @DisplayName("Should shift the cursor down when an earlier entry is removed")
        void shouldShiftCursorDown() {
            fill(a, b, c);
            journal.goTo(3);

            journal.removeByArticleNumber(1);

            assertThat(journal.cursor()).isEqualTo(2);
            assertThat(journal.current().article()).isEqualTo(c);
        }

        @Test
        @DisplayName("Should keep the cursor on the slot when the current entry is removed")
        void shouldNotSkipNextArticle() {
            fill(a, b, c);
            journal.goTo(2);

            journal.removeByArticleNumber(2);

            assertThat(journal.cursor()).isEqualTo(2);
            assertThat(journal.current().article()).isEqualTo(c);
        }

        @Test
        @DisplayName("Should leave an exhausted cursor exhausted")
        void shouldKeepExhaustedCursorExhausted() {
            fill(a, b, c);
            journal.goTo(3);
            journal.advance();

            journal.removeByArticleNumber(2);

            assertThat(journal.cursor()).isEqualTo(3);
            assertThat(journal.isExhausted()).isTrue();
        }

        @Test
        @DisplayName("Should become exhausted when the current last entry is removed")
        void shouldExhaustWhenCurrentLastRemoved() {
            fill(a, b);
            journal.goTo(2);

            journal.removeByArticleNumber(2);

            assertThat(journal.cursor()).isEqualTo(2);
            assertThat(journal.isExhausted()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 4})
        @DisplayName("Should fail with OutOfRange for invalid article numbers")
        void shouldFailOutOfRange(int articleNumber) {
            fill(a, b, c);

            assertKind(() -> journal.removeByArticleNumber(articleNumber), JournalErrorKind.OUT_OF_RANGE);
            assertThat(journal.length()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should put a re-appended entry at the end, not its old position")
        void shouldReappendAtEnd() {
            fill(a, b, c);

            ArticleRef removed = journal.removeByArticleNumber(1);
            int articleNumber = journal.append(removed);

            assertThat(journal.length()).isEqualTo(3);
            assertThat(articleNumber).isEqualTo(3);
            assertThat(ids()).containsExactly(2L, 3L, 1L);
        }
    }

    @Nested
    @DisplayName("removeById / removeByKey")
    class RemoveByLookup {

        @Test
        @DisplayName("Should remove by id")
        void shouldRemoveById() {
            fill(a, b, c);

            journal.removeById(3);

            assertThat(ids()).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("Should remove only the first match by id when duplicates are allowed")
        void shouldRemoveFirstMatch() {
            Journal permissive = new Journal(true);
            permissive.append(a);
            permissive.append(b);
            permissive.append(a);

            permissive.removeById(1);

            assertThat(permissive.entries()).extracting(e -> e.article().getId()).containsExactly(2L, 1L);
        }

        @Test
        @DisplayName("Should fail with NotFound for an unknown id")
        void shouldFailNotFoundById() {
            fill(a);

            assertKind(() -> journal.removeById(99), JournalErrorKind.NOT_FOUND);
        }

        @Test
        @DisplayName("Should remove by author, title and publication timestamp")
        void shouldRemoveByKey() {
            fill(a, b, c);

            ArticleRef removed = journal.removeByKey(b.getAuthor(), b.getTitle(), b.getPublishedAt());

            assertThat(removed).isEqualTo(b);
            assertThat(ids()).containsExactly(1L, 3L);
        }

        @Test
        @DisplayName("Should fail with NotFound when the key differs in publication timestamp")
        void shouldFailNotFoundByKey() {
            fill(a, b);

            assertKind(() -> journal.removeByKey(b.getAuthor(), b.getTitle(), b.getPublishedAt().plusDays(1)),
                    JournalErrorKind.NOT_FOUND);
            assertThat(journal.length()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should apply the removal cursor rule")
        void shouldAdjustCursor() {
            fill(a, b, c);
            journal.goTo(3);

            journal.removeById(1);

            assertThat(journal.cursor()).isEqualTo(2);
        }
    }

    // ==================== swap ====================

    @Nested
    @DisplayName("swap")
    class Swap {

        @Test
        @DisplayName("Should exchange two entries")
        void shouldSwap() {
            fill(a, b, c);

            journal.swap(1, 3);

            assertThat(ids()).containsExactly(3L, 2L, 1L);
            assertContiguousNumbers();
        }

        @Test
        @DisplayName("Should keep the cursor on the same slot")
        void shouldKeepCursorSlot() {
            fill(a, b, c);
            journal.goTo(1);

            journal.swap(1, 2);

            assertThat(journal.cursor()).isEqualTo(1);
            assertThat(journal.current().article()).isEqualTo(b);
        }

        @Test
        @DisplayName("Should be an involution")
        void shouldBeInvolution() {
            fill(a, b, c);

            journal.swap(1, journal.length());
            journal.swap(1, journal.length());

            assertThat(ids()).containsExactly(1L, 2L, 3L);
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 2, 3})
        @DisplayName("Should fail with InvalidArgument when swapping an entry with itself")
        void shouldRejectSelfSwap(int articleNumber) {
            fill(a, b, c);

            assertKind(() -> journal.swap(articleNumber, articleNumber), JournalErrorKind.INVALID_ARGUMENT);
        }

        @Test
        @DisplayName("Should fail with OutOfRange before checking equality")
        void shouldFailOutOfRange() {
            fill(a, b);

            assertKind(() -> journal.swap(1, 3), JournalErrorKind.OUT_OF_RANGE);
            assertKind(() -> journal.swap(5, 5), JournalErrorKind.OUT_OF_RANGE);
            assertThat(ids()).containsExactly(1L, 2L);
        }
    }

    // ==================== move ====================

    @Nested
    @DisplayName("moveToPosition")
    class MoveToPosition {

        @Test
        @DisplayName("Should move the second entry to the front")
        void shouldMoveToFrontOfTwo() {
            fill(a, b);

            journal.moveToPosition(2, 1);

            assertThat(ids()).containsExactly(2L, 1L);
            assertThat(journal.entryAt(1).article()).isEqualTo(b);
        }

        @Test
        @DisplayName("Should shift the entries in between")
        void shouldShiftEntriesBetween() {
            fill(a, b, c, article(4, "Delta"));

            journal.moveToPosition(1, 3);

            assertThat(ids()).containsExactly(2L, 3L, 1L, 4L);
            assertContiguousNumbers();
        }

        @Test
        @DisplayName("Should make the cursor follow the moved current entry")
        void shouldFollowMovedEntry() {
            fill(a, b, c);
            journal.goTo(1);

            journal.moveToPosition(1, 3);

            assertThat(journal.cursor()).isEqualTo(3);
            assertThat(journal.current().article()).isEqualTo(a);
        }

        @Test
        @DisplayName("Should make the cursor follow its entry when an earlier entry moves past it")
        void shouldFollowWhenEarlierEntryMovesBack() {
            fill(a, b, c);
            journal.goTo(2);

            journal.moveToPosition(1, 3);

            assertThat(journal.cursor()).isEqualTo(1);
            assertThat(journal.current().article()).isEqualTo(b);
        }

        @Test
        @DisplayName("Should make the cursor follow its entry when a later entry moves in front of it")
        void shouldFollowWhenLaterEntryMovesForward() {
            fill(a, b, c);
            journal.goTo(2);

            journal.moveToPosition(3, 1);

            assertThat(journal.cursor()).isEqualTo(3);
            assertThat(journal.current().article()).isEqualTo(b);
        }

        @Test
        @DisplayName("Should leave an exhausted cursor exhausted")
        void shouldKeepExhausted() {
            fill(a, b, c);
            journal.goTo(3);
            journal.advance();

            journal.moveToPosition(3, 1);

            assertThat(journal.cursor()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should treat a move onto itself as a no-op")
        void shouldNoOpOnSamePosition() {
            fill(a, b);

            journal.moveToPosition(2, 2);

            assertThat(ids()).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("Should fail with OutOfRange for invalid positions")
        void shouldFailOutOfRange() {
            fill(a, b);

            assertKind(() -> journal.moveToPosition(0, 1), JournalErrorKind.OUT_OF_RANGE);
            assertKind(() -> journal.moveToPosition(1, 3), JournalErrorKind.OUT_OF_RANGE);
        }

        @Test
        @DisplayName("Should move to front and to end")
        void shouldMoveToFrontAndEnd() {
            fill(a, b, c);

            journal.moveToFront(3);
            assertThat(ids()).containsExactly(3L, 1L, 2L);

            journal.moveToEnd(1);
            assertThat(ids()).containsExactly(1L, 2L, 3L);
        }

        @Test
        @DisplayName("Should fail moving to the end of an empty journal")
        void shouldFailOnEmpty() {
            assertKind(() -> journal.moveToEnd(1), JournalErrorKind.OUT_OF_RANGE);
            assertKind(() -> journal.moveToFront(1), JournalErrorKind.OUT_OF_RANGE);
        }
    }

    // ==================== clear / retrieval ====================

    @Nested
    @DisplayName("clear")
    class Clear {

        @Test
        @DisplayName("Should empty the journal and reset the cursor")
        void shouldClear() {
            fill(a, b);
            journal.goTo(2);

            journal.clear();

            assertThat(journal.isEmpty()).isTrue();
            assertThat(journal.cursor()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should succeed on an empty journal")
        void shouldClearEmpty() {
            journal.clear();

            assertThat(journal.length()).isZero();
        }
    }

    @Nested
    @DisplayName("retrieval")
    class Retrieval {

        @Test
        @DisplayName("Should find an entry by id with its article number")
        void shouldFindById() {
            fill(a, b, c);

            JournalEntry entry = journal.findById(2);

            assertThat(entry.articleNumber()).isEqualTo(2);
            assertThat(entry.article()).isEqualTo(b);
        }

        @Test
        @DisplayName("Should peek at the current entry without advancing")
        void shouldPeekCurrent() {
            fill(a, b);

            assertThat(journal.current().article()).isEqualTo(a);
            assertThat(journal.cursor()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail with JournalExhausted when peeking an empty journal")
        void shouldFailPeekOnEmpty() {
            assertKind(() -> journal.current(), JournalErrorKind.JOURNAL_EXHAUSTED);
        }

        @Test
        @DisplayName("Should fail with OutOfRange for goTo past the end")
        void shouldFailGoToPastEnd() {
            fill(a);

            assertKind(() -> journal.goTo(2), JournalErrorKind.OUT_OF_RANGE);
            assertThat(journal.cursor()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should return a snapshot of entries")
        void shouldReturnSnapshot() {
            fill(a, b);
            List<JournalEntry> before = journal.entries();

            journal.swap(1, 2);

            assertThat(before).extracting(e -> e.article().getId()).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("Should look up the article number by key")
        void shouldLookUpByKey() {
            fill(a, b, c);

            assertThat(journal.articleNumberOfKey(c.getAuthor(), c.getTitle(), c.getPublishedAt())).isEqualTo(3);
        }
    }

    // ==================== invariants ====================

    @Test
    @DisplayName("Should keep article numbers contiguous across a mixed sequence of mutations")
    void shouldKeepNumbersContiguous() {
        fill(a, b, c, article(4, "Delta"), article(5, "Echo"));
        assertContiguousNumbers();

        journal.goTo(3);
        journal.removeByArticleNumber(1);
        assertContiguousNumbers();
        journal.swap(1, 4);
        assertContiguousNumbers();
        journal.moveToPosition(4, 2);
        assertContiguousNumbers();
        journal.removeById(5);
        assertContiguousNumbers();
        journal.append(article(6, "Foxtrot"));
        assertContiguousNumbers();
        journal.moveToEnd(1);
        assertContiguousNumbers();
        journal.clear();
        assertContiguousNumbers();
    }
}
