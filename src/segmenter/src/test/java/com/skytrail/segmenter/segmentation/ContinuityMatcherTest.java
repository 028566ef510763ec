package com.skytrail.segmenter.segmentation;

import static com.skytrail.segmenter.TestPositions.at;
import static com.skytrail.segmenter.TestPositions.concat;
import static com.skytrail.segmenter.TestPositions.position;
import static com.skytrail.segmenter.TestPositions.track;
import static org.assertj.core.api.Assertions.assertThat;

import com.skytrail.segmenter.model.CandidatePosition;
import com.skytrail.segmenter.model.FlightTail;
import com.skytrail.segmenter.model.FlightTailState;
import com.skytrail.segmenter.model.LabeledPosition;
import com.skytrail.segmenter.model.OdKey;
import com.skytrail.segmenter.model.PositionRecord;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContinuityMatcherTest {
  private static final Duration SIX_HOURS = Duration.ofHours(6);
  private static final int MIN_POINTS = 3;
  private static final OdKey Y_LONDON_EDINBURGH = new OdKey("yyy999", "EGLL", "EGPH");

  @Test
  void everyCandidateIsFreshWithoutTails() {
    List<CandidatePosition> candidates = grouped(track("yyy999", "EGLL", "EGPH", at(23, 30), 4));

    MatchResult result = ContinuityMatcher.match(candidates, FlightTailState.empty(), SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).isEmpty();
    assertThat(result.fresh()).isEqualTo(candidates);
    assertThat(result.continuedFlights()).isZero();
  }

  @Test
  void continuesOpenTailWithSameOdKey() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(7L, Y_LONDON_EDINBURGH, at(23, 0))));
    List<CandidatePosition> candidates = grouped(concat(
        track("yyy999", "EGLL", "EGPH", at(23, 30), 2),
        track("zzz000", "EGKK", "EGCC", at(23, 30), 4)));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).hasSize(2).extracting(LabeledPosition::flightId).containsOnly(7L);
    assertThat(result.fresh()).hasSize(4)
        .extracting(c -> c.position().icaoAddress()).containsOnly("zzz000");
    assertThat(result.continuedFlights()).isEqualTo(1);
  }

  @Test
  void onlyTheFirstRunOfTheKeyContinues() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(3L, Y_LONDON_EDINBURGH, at(0, 0))));
    List<CandidatePosition> candidates = grouped(concat(
        track("yyy999", "EGLL", "EGPH", at(0, 10), 4),
        track("yyy999", "EGPH", "EGLL", at(2, 0), 4),
        track("yyy999", "EGLL", "EGPH", at(4, 0), 4)));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).hasSize(4)
        .extracting(l -> l.position().timestamp())
        .allMatch(ts -> ts.isBefore(at(1, 0)));
    assertThat(result.fresh()).hasSize(8);
  }

  @Test
  void doesNotContinueDifferentOdKeyOfSameAircraft() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(3L, Y_LONDON_EDINBURGH, at(0, 0))));
    List<CandidatePosition> candidates = grouped(track("yyy999", "EGLL", "EGKK", at(0, 10), 4));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).isEmpty();
    assertThat(result.fresh()).hasSize(4);
  }

  @Test
  void rejectsContinuationLaterThanTheWindowAfterTheTail() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(3L, Y_LONDON_EDINBURGH, at(0, 0))));
    List<CandidatePosition> candidates = grouped(track("yyy999", "EGLL", "EGPH", at(7, 0), 4));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).isEmpty();
  }

  @Test
  void ignoresKeysFirstSeenAfterTheHorizonFromChunkStart() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(3L, Y_LONDON_EDINBURGH, at(6, 50))));
    List<CandidatePosition> candidates = grouped(concat(
        track("aaa111", "EGKK", "EGCC", at(0, 0), 4),
        track("yyy999", "EGLL", "EGPH", at(7, 0), 4)));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).isEmpty();
    assertThat(result.fresh()).hasSize(8);
  }

  @Test
  void rejectsKeyFirstSeenLongBeforeTheTail() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(0L, Y_LONDON_EDINBURGH, at(23, 0))));
    List<CandidatePosition> candidates = grouped(track("yyy999", "EGLL", "EGPH", at(9, 0), 5));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).isEmpty();
    assertThat(result.fresh()).hasSize(5);
  }

  @Test
  void acceptsOverlapWithinTheWindowBeforeTheTail() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(4L, Y_LONDON_EDINBURGH, at(10, 0))));
    List<CandidatePosition> candidates = grouped(track("yyy999", "EGLL", "EGPH", at(9, 30), 2));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).hasSize(2).extracting(LabeledPosition::flightId).containsOnly(4L);
  }

  @Test
  void continuedFlightTakesLaterRunAfterShortBlip() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(0L, Y_LONDON_EDINBURGH, at(0, 3))));
    List<CandidatePosition> candidates = grouped(concat(
        List.of(position("yyy999", "EGLL", "EGPH", at(0, 4))),
        List.of(position("yyy999", "EGLL", "LFPG", at(0, 5))),
        track("yyy999", "EGLL", "EGPH", at(0, 6), 5)));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).hasSize(6).extracting(LabeledPosition::flightId).containsOnly(0L);
    assertThat(result.fresh()).isEmpty();
    assertThat(result.noiseRows()).isEqualTo(1);
    assertThat(result.continuedFlights()).isEqualTo(1);
  }

  @Test
  void continuedFlightStopsAtLongRunOfAnotherKey() {
    FlightTailState tails = FlightTailState.of(List.of(new FlightTail(0L, Y_LONDON_EDINBURGH, at(0, 3))));
    List<CandidatePosition> candidates = grouped(concat(
        track("yyy999", "EGLL", "EGPH", at(0, 4), 2),
        track("yyy999", "EGLL", "LFPG", at(0, 10), 4),
        track("yyy999", "EGLL", "EGPH", at(1, 0), 5)));

    MatchResult result = ContinuityMatcher.match(candidates, tails, SIX_HOURS, SIX_HOURS, MIN_POINTS);

    assertThat(result.continued()).hasSize(2);
    assertThat(result.fresh()).hasSize(9);
    assertThat(result.noiseRows()).isZero();
  }

  private static List<CandidatePosition> grouped(List<PositionRecord> records) {
    return CandidateGrouper.group(TrackRepairer.repair(records));
  }
}
