package com.flamingo.ai.bookviews.ledger;

import com.flamingo.ai.bookviews.domain.CheckpointEntry;
import java.io.IOException;
import java.util.List;

/** Durable storage for whole-ledger snapshots. A save replaces the previous snapshot atomically. */
public interface CheckpointStore {

  void save(List<CheckpointEntry> entries) throws IOException;

  /** The last saved snapshot, or an empty list when none exists. */
  List<CheckpointEntry> load() throws IOException;
}
