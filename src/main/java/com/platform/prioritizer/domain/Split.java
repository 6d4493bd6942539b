package com.platform.prioritizer.domain;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * One train/test partition of time.
 * <p>
 * Every training as-of date is at or before {@code trainEnd}; every test as-of date
 * is strictly after it. Both lists are sorted ascending.
 */
public record Split(
        LocalDateTime trainEnd,
        List<LocalDateTime> asOfDatesTrain,
        List<LocalDateTime> asOfDatesTest,
        Timespan labelTimespanTrain,
        Timespan labelTimespanTest,
        Timespan trainingAsOfDateFrequency,
        Timespan maxTrainingHistory,
        Timespan testDuration,
        Timespan testAsOfDateFrequency
) {

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    public Split {
        asOfDatesTrain = List.copyOf(asOfDatesTrain);
        asOfDatesTest = List.copyOf(asOfDatesTest);
        for (LocalDateTime d : asOfDatesTrain) {
            if (d.isAfter(trainEnd)) {
                throw new IllegalArgumentException("Training as-of date " + d + " is after train end " + trainEnd);
            }
        }
        for (LocalDateTime d : asOfDatesTest) {
            if (!d.isAfter(trainEnd)) {
                throw new IllegalArgumentException("Test as-of date " + d + " is not after train end " + trainEnd);
            }
        }
    }

    /**
     * Deterministic identifier, stable across runs with the same temporal config.
     */
    public String id() {
        return String.join("_",
                trainEnd.format(ID_FORMAT),
                "tr" + labelTimespanTrain.text().replace(" ", ""),
                "te" + labelTimespanTest.text().replace(" ", ""),
                "f" + trainingAsOfDateFrequency.text().replace(" ", ""),
                "h" + maxTrainingHistory.text().replace(" ", ""),
                "d" + testDuration.text().replace(" ", ""),
                "tf" + testAsOfDateFrequency.text().replace(" ", ""));
    }
}
