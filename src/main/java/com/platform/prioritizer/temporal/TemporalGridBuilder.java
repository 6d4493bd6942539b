package com.platform.prioritizer.temporal;

import com.platform.prioritizer.domain.Split;
import com.platform.prioritizer.domain.TemporalConfig;
import com.platform.prioritizer.domain.Timespan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Derives train/test splits from a {@link TemporalConfig}.
 * <p>
 * Train end dates start at {@code label_start_time} and advance by
 * {@code model_update_frequency} while the whole test window still fits before
 * {@code feature_end_time}. Training as-of dates walk backwards from the train end,
 * bounded by the max training history and {@code feature_start_time}; test as-of
 * dates walk forwards through the test duration.
 * <p>
 * The returned {@link Iterable} is lazy: splits are computed one train end at a time,
 * and each call to {@code iterator()} starts over.
 */
@Component
public class TemporalGridBuilder {

    private static final Logger log = LoggerFactory.getLogger(TemporalGridBuilder.class);

    public Iterable<Split> splits(TemporalConfig config) {
        return () -> new SplitIterator(config);
    }

    public List<Split> allSplits(TemporalConfig config) {
        List<Split> result = new ArrayList<>();
        splits(config).forEach(result::add);
        return result;
    }

    /**
     * Train end instants for one test duration, ascending.
     */
    List<LocalDateTime> trainEnds(TemporalConfig config, Timespan testDuration) {
        LocalDateTime lastTrainEnd = testDuration.subtractFrom(config.featureEndTime());
        List<LocalDateTime> ends = new ArrayList<>();
        LocalDateTime current = config.labelStartTime();
        int step = 0;
        while (!current.isAfter(lastTrainEnd)) {
            ends.add(current);
            step++;
            current = advance(config.labelStartTime(), config.modelUpdateFrequency(), step);
        }
        return ends;
    }

    List<LocalDateTime> trainingAsOfDates(TemporalConfig config, LocalDateTime trainEnd,
                                          Timespan frequency, Timespan maxHistory) {
        LocalDateTime historyStart = maxHistory.subtractFrom(trainEnd);
        LocalDateTime earliest = historyStart.isAfter(config.featureStartTime())
                ? historyStart : config.featureStartTime();

        List<LocalDateTime> dates = new ArrayList<>();
        LocalDateTime current = trainEnd;
        int step = 0;
        while (!current.isBefore(earliest)) {
            if (!current.isAfter(config.featureEndTime())) {
                dates.add(current);
            }
            step++;
            current = retreat(trainEnd, frequency, step);
        }
        Collections.reverse(dates);
        return dates;
    }

    List<LocalDateTime> testAsOfDates(TemporalConfig config, LocalDateTime trainEnd,
                                      Timespan frequency, Timespan testDuration) {
        LocalDateTime testEnd = testDuration.addTo(trainEnd);
        List<LocalDateTime> dates = new ArrayList<>();
        int step = 1;
        LocalDateTime current = advance(trainEnd, frequency, step);
        while (!current.isAfter(testEnd)) {
            if (!current.isBefore(config.featureStartTime()) && !current.isAfter(config.featureEndTime())) {
                dates.add(current);
            }
            step++;
            current = advance(trainEnd, frequency, step);
        }
        return dates;
    }

    // Stepping from the anchor each time keeps month-end arithmetic from drifting.
    private static LocalDateTime advance(LocalDateTime anchor, Timespan span, int steps) {
        return anchor.plus(span.period().multipliedBy(steps)).plus(span.duration().multipliedBy(steps));
    }

    private static LocalDateTime retreat(LocalDateTime anchor, Timespan span, int steps) {
        return anchor.minus(span.period().multipliedBy(steps)).minus(span.duration().multipliedBy(steps));
    }

    private final class SplitIterator implements Iterator<Split> {

        private final TemporalConfig config;
        private final Deque<Split> pending = new ArrayDeque<>();
        private final List<Timespan> testDurations;
        private int durationIndex = 0;
        private List<LocalDateTime> currentEnds = List.of();
        private int endIndex = 0;

        SplitIterator(TemporalConfig config) {
            this.config = config;
            this.testDurations = config.testDurations();
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty()) {
                if (endIndex >= currentEnds.size()) {
                    if (durationIndex >= testDurations.size()) {
                        return false;
                    }
                    currentEnds = trainEnds(config, testDurations.get(durationIndex));
                    endIndex = 0;
                    durationIndex++;
                    continue;
                }
                fill(currentEnds.get(endIndex++), testDurations.get(durationIndex - 1));
            }
            return true;
        }

        @Override
        public Split next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private void fill(LocalDateTime trainEnd, Timespan testDuration) {
            for (Timespan trainFrequency : config.trainingAsOfDateFrequencies()) {
                for (Timespan maxHistory : config.maxTrainingHistories()) {
                    List<LocalDateTime> trainDates = trainingAsOfDates(config, trainEnd, trainFrequency, maxHistory);
                    if (trainDates.isEmpty()) {
                        log.debug("Dropping train end {}: no training as-of dates within history {}",
                                trainEnd, maxHistory);
                        continue;
                    }
                    for (Timespan testFrequency : config.testAsOfDateFrequencies()) {
                        List<LocalDateTime> testDates = testAsOfDates(config, trainEnd, testFrequency, testDuration);
                        if (testDates.isEmpty()) {
                            log.debug("Dropping train end {}: no test as-of dates within [{}, {}]",
                                    trainEnd, config.featureStartTime(), config.featureEndTime());
                            continue;
                        }
                        for (Timespan trainLabel : config.trainingLabelTimespans()) {
                            for (Timespan testLabel : config.testLabelTimespans()) {
                                pending.add(new Split(trainEnd, trainDates, testDates, trainLabel, testLabel,
                                        trainFrequency, maxHistory, testDuration, testFrequency));
                            }
                        }
                    }
                }
            }
        }
    }
}
