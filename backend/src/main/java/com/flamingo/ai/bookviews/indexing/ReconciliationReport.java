package com.flamingo.ai.bookviews.indexing;

/** Ledger {@code DONE} count compared to the index's record count for one corpus. */
public record ReconciliationReport(String corpus, long ledgerDone, long indexed) {

  /** The index may legitimately hold more records than this run produced. */
  public boolean isConsistent() {
    return ledgerDone == indexed;
  }
}
