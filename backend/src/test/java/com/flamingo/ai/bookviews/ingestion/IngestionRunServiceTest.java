package com.flamingo.ai.bookviews.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.bookviews.exception.ConfigurationException;
import com.flamingo.ai.bookviews.exception.IngestionAlreadyRunningException;
import com.flamingo.ai.bookviews.indexing.VectorIndex;
import com.flamingo.ai.bookviews.ledger.CheckpointLedger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionRunService Tests")
class IngestionRunServiceTest {

  @Mock private IngestionOrchestrator orchestrator;
  @Mock private VectorIndex vectorIndex;
  @Mock private CheckpointLedger ledger;

  private final List<Runnable> queued = new ArrayList<>();
  private IngestionRunService service;

  @BeforeEach
  void setUp() {
    service = new IngestionRunService(orchestrator, queued::add, vectorIndex, ledger);
  }

  private static IngestionStats stats(boolean cancelled) {
    return new IngestionStats(2, 1, 0, 0, Map.of(), cancelled, null);
  }

  @Test
  @DisplayName("should track a run from start to completion")
  void shouldCompleteRun() {
    when(orchestrator.run(any(IngestionContext.class), eq("books/"))).thenReturn(stats(false));

    IngestionRun run = service.start("books/");
    assertThat(run.isActive()).isTrue();
    queued.forEach(Runnable::run);

    assertThat(run.getState()).isEqualTo(IngestionRun.State.COMPLETED);
    assertThat(run.getStats().processed()).isEqualTo(2);
    assertThat(run.getFinishedAt()).isNotNull();
    assertThat(service.current()).containsSame(run);
  }

  @Test
  @DisplayName("should refuse a second run while one is active")
  void shouldRejectSecondRun() {
    service.start("books/");

    assertThatThrownBy(() -> service.start("books/"))
        .isInstanceOf(IngestionAlreadyRunningException.class);
  }

  @Test
  @DisplayName("should cancel the active run cooperatively")
  void shouldCancelRun() {
    when(orchestrator.run(any(IngestionContext.class), eq("books/"))).thenReturn(stats(true));
    IngestionRun run = service.start("books/");

    assertThat(service.cancelCurrent()).containsSame(run);
    assertThat(run.getContext().isCancelled()).isTrue();
    queued.forEach(Runnable::run);

    assertThat(run.getState()).isEqualTo(IngestionRun.State.CANCELLED);
    assertThat(service.cancelCurrent()).isEmpty();
  }

  @Test
  @DisplayName("should record a failed run and allow a new one")
  void shouldRecordFailure() {
    when(orchestrator.run(any(IngestionContext.class), eq("books/")))
        .thenThrow(new ConfigurationException("Embedding dimension mismatch"));

    IngestionRun run = service.start("books/");
    queued.forEach(Runnable::run);

    assertThat(run.getState()).isEqualTo(IngestionRun.State.FAILED);
    assertThat(run.getError()).contains("dimension mismatch");
    queued.clear();
    assertThat(service.start("books/")).isNotSameAs(run);
  }

  @Test
  @DisplayName("should return a purged corpus to pending so the next run ingests it again")
  @SuppressWarnings("unchecked")
  void shouldResetLedger_whenCorpusPurged() {
    when(vectorIndex.purge("books")).thenReturn(2L);
    when(ledger.reset(any())).thenReturn(2);

    CorpusPurge purge = service.purge("books");

    assertThat(purge).isEqualTo(new CorpusPurge("books", 2L, 2));
    ArgumentCaptor<Predicate<String>> owned = ArgumentCaptor.forClass(Predicate.class);
    InOrder order = inOrder(vectorIndex, ledger);
    order.verify(vectorIndex).purge("books");
    order.verify(ledger).reset(owned.capture());
    order.verify(ledger).snapshot();
    assertThat(owned.getValue().test("books.emma")).isTrue();
    assertThat(owned.getValue().test("books.sub.emma")).isTrue();
    assertThat(owned.getValue().test("classics.emma")).isFalse();
    assertThat(owned.getValue().test("books-extra.emma")).isFalse();
  }

  @Test
  @DisplayName("should reset every ledger entry when the whole index is purged")
  @SuppressWarnings("unchecked")
  void shouldResetAll_whenWholeIndexPurged() {
    service.purge(null);

    ArgumentCaptor<Predicate<String>> owned = ArgumentCaptor.forClass(Predicate.class);
    verify(ledger).reset(owned.capture());
    assertThat(owned.getValue().test("classics.emma")).isTrue();
    verify(vectorIndex).purge(null);
  }

  @Test
  @DisplayName("should refuse to purge while a run is active")
  void shouldRejectPurge_whileRunActive() {
    service.start("books/");

    assertThatThrownBy(() -> service.purge("books"))
        .isInstanceOf(IngestionAlreadyRunningException.class);
    verifyNoInteractions(vectorIndex, ledger);
  }
}
