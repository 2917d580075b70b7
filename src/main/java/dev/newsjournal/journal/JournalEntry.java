package dev.newsjournal.journal;

/**
 * An article together with its article number at the moment the entry was produced.
 * Article numbers shift after every structural change, so entries are snapshots.
 */
public record JournalEntry(int articleNumber, ArticleRef article) {}
