package com.skytrail.segmenter.segmentation;

import static com.skytrail.segmenter.TestPositions.at;
import static com.skytrail.segmenter.TestPositions.concat;
import static com.skytrail.segmenter.TestPositions.track;
import static org.assertj.core.api.Assertions.assertThat;

import com.skytrail.segmenter.model.CandidatePosition;
import com.skytrail.segmenter.model.PositionRecord;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NoiseFilterTest {

  @Test
  void emptyInputYieldsEmptyOutput() {
    assertThat(NoiseFilter.filter(List.of(), 3)).isEmpty();
  }

  @Test
  void dropsCandidatesWithMinPointsOrFewer() {
    List<CandidatePosition> candidates = CandidateGrouper.group(concat(
        track("aaa111", "EGLL", "EGPH", at(0, 0), 2),
        track("bbb222", "EGLL", "EGPH", at(0, 0), 3),
        track("ccc333", "EGLL", "EGPH", at(0, 0), 4)));

    List<CandidatePosition> kept = NoiseFilter.filter(candidates, 3);

    assertThat(kept).hasSize(4).extracting(c -> c.position().icaoAddress()).containsOnly("ccc333");
    assertThat(kept).extracting(CandidatePosition::candidateId).containsOnly(0);
  }

  @Test
  void renumbersSurvivorsDenselyFromZero() {
    List<CandidatePosition> candidates = CandidateGrouper.group(concat(
        track("aaa111", "EGLL", "EGPH", at(0, 0), 5),
        track("aaa111", "EGPH", "EGKK", at(1, 0), 2),
        track("aaa111", "EGKK", "EGCC", at(2, 0), 5),
        track("bbb222", "EGLL", "EGPH", at(0, 0), 1),
        track("ccc333", "EGLL", "EGPH", at(0, 0), 6)));

    List<CandidatePosition> kept = NoiseFilter.filter(candidates, 3);

    assertThat(kept).extracting(CandidatePosition::candidateId).containsExactly(
        0, 0, 0, 0, 0,
        1, 1, 1, 1, 1,
        2, 2, 2, 2, 2, 2);
  }

  @Test
  void mergesRunsOfOneKeySeparatedOnlyByNoise() {
    List<CandidatePosition> candidates = CandidateGrouper.group(concat(
        track("aaa111", "EGLL", "EGPH", at(0, 0), 5),
        track("aaa111", "EGLL", "LFPG", at(0, 5), 1),
        track("aaa111", "EGLL", "EGPH", at(0, 6), 5)));

    List<CandidatePosition> kept = NoiseFilter.filter(candidates, 3);

    assertThat(kept).hasSize(10).extracting(CandidatePosition::candidateId).containsOnly(0);
  }

  @Test
  void keepsRunsApartWhenAContinuedCandidateSitsBetweenThem() {
    List<CandidatePosition> grouped = CandidateGrouper.group(concat(
        track("aaa111", "EGLL", "EGPH", at(0, 0), 5),
        track("aaa111", "EGPH", "EGLL", at(1, 0), 5),
        track("aaa111", "EGLL", "EGPH", at(2, 0), 5)));
    List<CandidatePosition> fresh = new ArrayList<>();
    for (CandidatePosition candidate : grouped) {
      if (candidate.candidateId() != 1) {
        fresh.add(candidate);
      }
    }

    List<CandidatePosition> kept = NoiseFilter.filter(fresh, 3);

    assertThat(kept).extracting(CandidatePosition::candidateId).containsExactly(0, 0, 0, 0, 0, 1, 1, 1, 1, 1);
  }

  @Test
  void zeroMinPointsKeepsSinglePositionCandidates() {
    List<PositionRecord> single = track("aaa111", "EGLL", "EGPH", at(0, 0), 1);

    assertThat(NoiseFilter.filter(CandidateGrouper.group(single), 0)).hasSize(1);
  }
}
