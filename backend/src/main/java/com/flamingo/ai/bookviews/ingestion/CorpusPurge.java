package com.flamingo.ai.bookviews.ingestion;

/**
 * Outcome of purging a corpus.
 *
 * @param corpus purged corpus, or {@code null} for the whole index
 * @param deleted index records removed
 * @param ledgerReset ledger entries returned to pending
 */
public record CorpusPurge(String corpus, long deleted, int ledgerReset) {}
