package com.consullo.errorjournal.core;

import com.consullo.errorjournal.core.events.DumpEntry;
import com.consullo.errorjournal.core.events.DumpVisitor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Tests for dump/replay ranges, ordering and isolation from visitor side effects.
 *
 * @since 1.0
 */
public class ErrorJournalDumpTest {

  private static void raiseMany(ErrorJournal journal, int count) {
    for (int i = 0; i < count; i++) {
      journal.raise(StandardErrorCode.ILLEGAL_INPUT, ErrorOrigin.of("dump.c", i + 1, "fill"), "e%d", i);
    }
  }

  @Test
  @DisplayName("Should visit each position after the state in ascending order")
  void dump_Forward_VisitsConsecutivePositions() {
    final ErrorJournal journal = new ErrorJournal();
    raiseMany(journal, 2);
    final ErrorState state = journal.capture();
    raiseMany(journal, 3);
    final DumpVisitor visitor = mock(DumpVisitor.class);

    journal.dump(state, false, visitor);

    InOrder inOrder = inOrder(visitor);
    inOrder.verify(visitor).visit(3L, 3L, 5L);
    inOrder.verify(visitor).visit(4L, 3L, 5L);
    inOrder.verify(visitor).visit(5L, 3L, 5L);
    verifyNoMoreInteractions(visitor);
  }

  @Test
  @DisplayName("Should visit the same positions in descending order when reversed")
  void dump_Reverse_VisitsDescending() {
    final ErrorJournal journal = new ErrorJournal();
    raiseMany(journal, 2);
    final ErrorState state = journal.capture();
    raiseMany(journal, 3);
    final DumpVisitor visitor = mock(DumpVisitor.class);

    journal.dump(state, true, visitor);

    InOrder inOrder = inOrder(visitor);
    inOrder.verify(visitor).visit(5L, 5L, 3L);
    inOrder.verify(visitor).visit(4L, 5L, 3L);
    inOrder.verify(visitor).visit(3L, 5L, 3L);
    verifyNoMoreInteractions(visitor);
  }

  @Test
  @DisplayName("Should call the visitor once with zeros when nothing was raised since the state")
  void dump_EmptyRange_CallsOnceWithZeros() {
    final ErrorJournal journal = new ErrorJournal();
    final DumpVisitor onEmpty = mock(DumpVisitor.class);
    journal.dump(ErrorState.NONE, false, onEmpty);
    verify(onEmpty, times(1)).visit(0L, 0L, 0L);
    verifyNoMoreInteractions(onEmpty);

    raiseMany(journal, 4);
    final DumpVisitor upToDate = mock(DumpVisitor.class);
    journal.dump(journal.capture(), true, upToDate);
    verify(upToDate, times(1)).visit(0L, 0L, 0L);
    verifyNoMoreInteractions(upToDate);
  }

  @Test
  @DisplayName("Should stop at the view, not at the total, after a restore")
  void dump_AfterRestore_EndsAtView() {
    final ErrorJournal journal = new ErrorJournal();
    raiseMany(journal, 3);
    final ErrorState state = journal.capture();
    raiseMany(journal, 2);
    journal.restore(state);
    final DumpVisitor visitor = mock(DumpVisitor.class);

    journal.dump(ErrorState.NONE, false, visitor);

    verify(visitor).visit(1L, 1L, 3L);
    verify(visitor).visit(2L, 1L, 3L);
    verify(visitor).visit(3L, 1L, 3L);
    verifyNoMoreInteractions(visitor);
  }

  @Test
  @DisplayName("Should present each visited record as current and evicted ones as HISTORY_LOST")
  void dump_WithEvictedPositions_ResolvesHistoryLost() {
    final ErrorJournal journal = new ErrorJournal();
    raiseMany(journal, ErrorHistory.CAPACITY + 5);
    final List<ErrorRecord> seen = new ArrayList<>();

    journal.dump(ErrorState.NONE, false, (self, first, last) -> seen.add(journal.current()));

    assertThat(seen).hasSize(ErrorHistory.CAPACITY + 5);
    for (int i = 0; i < seen.size(); i++) {
      ErrorRecord record = seen.get(i);
      assertThat(record.position()).isEqualTo(i + 1L);
      if (i < 5) {
        assertThat(record.code()).isEqualTo(StandardErrorCode.HISTORY_LOST);
      } else {
        assertThat(record.code()).isEqualTo(StandardErrorCode.ILLEGAL_INPUT);
        assertThat(record.message()).isEqualTo("Illegal input: e" + i);
      }
    }
  }

  @Test
  @DisplayName("Should leave the journal untouched by visitor raises, restores and resets")
  void dump_MutatingVisitor_StateRestoredAfterwards() {
    final ErrorJournal journal = new ErrorJournal();
    raiseMany(journal, 3);
    final ErrorRecord before = journal.current();
    final ErrorRecord firstBefore = journal.recordAt(1L);
    final List<Long> visited = new ArrayList<>();
    final List<ErrorRecord> currents = new ArrayList<>();

    journal.dump(ErrorState.NONE, false, (self, first, last) -> {
      visited.add(self);
      raiseMany(journal, ErrorHistory.CAPACITY + 1);
      journal.restore(ErrorState.NONE);
      journal.reset();
      journal.raise(StandardErrorCode.FILE_IO, ErrorOrigin.EMPTY, "inside visitor");
      currents.add(journal.current());
      journal.clear();
    });

    assertThat(visited).containsExactly(1L, 2L, 3L);
    assertThat(currents).extracting(ErrorRecord::position).containsExactly(1L, 2L, 3L);
    assertThat(currents).extracting(ErrorRecord::code).containsOnly(StandardErrorCode.ILLEGAL_INPUT);
    assertThat(journal.current()).isEqualTo(before);
    assertThat(journal.total()).isEqualTo(3L);
    assertThat(journal.recordAt(1L)).isEqualTo(firstBefore);
    assertThat(journal.raise(StandardErrorCode.FILE_IO, ErrorOrigin.EMPTY, "next").position()).isEqualTo(4L);
  }

  @Test
  @DisplayName("Should restore the journal when the visitor throws")
  void dump_ThrowingVisitor_StateRestored() {
    final ErrorJournal journal = new ErrorJournal();
    raiseMany(journal, 2);
    final ErrorState state = journal.capture();

    assertThatThrownBy(() -> journal.dump(ErrorState.NONE, false, (self, first, last) -> {
      journal.raise(StandardErrorCode.FILE_IO, ErrorOrigin.EMPTY, "partial");
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

    assertThat(journal.isEqual(state)).isTrue();
    assertThat(journal.total()).isEqualTo(2L);
    // The journal is usable for the next dump.
    final DumpVisitor visitor = mock(DumpVisitor.class);
    journal.dump(state, false, visitor);
    verify(visitor).visit(0L, 0L, 0L);
  }

  @Test
  @DisplayName("Should ignore a dump started from inside a visitor")
  void dump_NestedDump_Ignored() {
    final ErrorJournal journal = new ErrorJournal();
    raiseMany(journal, 2);
    final DumpVisitor inner = mock(DumpVisitor.class);
    final List<Long> outer = new ArrayList<>();

    journal.dump(ErrorState.NONE, false, (self, first, last) -> {
      outer.add(self);
      journal.dump(ErrorState.NONE, false, inner);
    });

    assertThat(outer).containsExactly(1L, 2L);
    verifyNoInteractions(inner);
  }

  @Test
  @DisplayName("Should list the same tuples as the push-style dump")
  void entriesSince_Range_MatchesDump() {
    final ErrorJournal journal = new ErrorJournal();
    raiseMany(journal, 1);
    final ErrorState state = journal.capture();
    raiseMany(journal, 3);

    final List<DumpEntry> forward = journal.entriesSince(state, false);
    final List<DumpEntry> reverse = journal.entriesSince(state, true);

    assertThat(forward).extracting(DumpEntry::self).containsExactly(2L, 3L, 4L);
    assertThat(forward).allSatisfy(e -> {
      assertThat(e.first()).isEqualTo(2L);
      assertThat(e.last()).isEqualTo(4L);
      assertThat(e.isReverse()).isFalse();
      assertThat(e.record().position()).isEqualTo(e.self());
    });
    assertThat(reverse).extracting(DumpEntry::self).containsExactly(4L, 3L, 2L);
    assertThat(reverse.get(0).isReverse()).isTrue();
    assertThat(journal.entriesSince(journal.capture(), false)).containsExactly(DumpEntry.nothingToReport());
  }
}
