package com.tickdata.unit.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tickdata.exception.InvalidFrequencyException;
import com.tickdata.timeseries.TimeBucketer;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TimeBucketerTest {

    @Nested
    @DisplayName("bucketStart")
    class BucketStart {

        @Test
        @DisplayName("floors a timestamp onto a 5-second boundary")
        void floorsToFiveSeconds() {
            assertThat(TimeBucketer.bucketStart(LocalDateTime.of(2022, 4, 4, 9, 15, 3), 5))
                    .isEqualTo(LocalDateTime.of(2022, 4, 4, 9, 15, 0));
            assertThat(TimeBucketer.bucketStart(LocalDateTime.of(2022, 4, 4, 9, 15, 7), 5))
                    .isEqualTo(LocalDateTime.of(2022, 4, 4, 9, 15, 5));
        }

        @Test
        @DisplayName("a timestamp on a boundary starts its own bucket")
        void boundaryIsInclusive() {
            LocalDateTime boundary = LocalDateTime.of(2022, 4, 4, 9, 20, 0);

            assertThat(TimeBucketer.bucketStart(boundary, 300)).isEqualTo(boundary);
        }

        @Test
        @DisplayName("drops sub-second precision")
        void dropsNanos() {
            LocalDateTime timestamp = LocalDateTime.of(2022, 4, 4, 9, 15, 4, 999_000_000);

            assertThat(TimeBucketer.bucketStart(timestamp, 1)).isEqualTo(LocalDateTime.of(2022, 4, 4, 9, 15, 4));
        }

        @Test
        @DisplayName("a day-long frequency maps every timestamp to midnight of its date")
        void dailyBucketsStartAtMidnight() {
            assertThat(TimeBucketer.bucketStart(LocalDateTime.of(2022, 4, 4, 15, 29, 59), TimeBucketer.SECONDS_PER_DAY))
                    .isEqualTo(LocalDateTime.of(2022, 4, 4, 0, 0));
        }

        @Test
        @DisplayName("buckets that do not divide a day still align to a fixed epoch")
        void nonDivisorFrequencyIsEpochAligned() {
            LocalDateTime a = TimeBucketer.bucketStart(LocalDateTime.of(2022, 4, 4, 9, 15, 0), 7);
            LocalDateTime b = TimeBucketer.bucketStart(LocalDateTime.of(2022, 4, 4, 9, 15, 6), 7);

            assertThat(a).isBeforeOrEqualTo(LocalDateTime.of(2022, 4, 4, 9, 15, 0));
            assertThat(b).isAfter(LocalDateTime.of(2022, 4, 4, 9, 15, 6).minusSeconds(7));
            assertThat(b).isBeforeOrEqualTo(LocalDateTime.of(2022, 4, 4, 9, 15, 6));
        }

        @Test
        @DisplayName("handles timestamps before the epoch")
        void floorsNegativeEpochSeconds() {
            assertThat(TimeBucketer.bucketStart(LocalDateTime.of(1969, 12, 31, 23, 59, 59), 60))
                    .isEqualTo(LocalDateTime.of(1969, 12, 31, 23, 59, 0));
        }
    }

    @Nested
    @DisplayName("frequency validation")
    class FrequencyValidation {

        @ParameterizedTest
        @ValueSource(longs = {0, -1, -86_400})
        @DisplayName("rejects non-positive frequencies")
        void rejectsNonPositive(long frequency) {
            assertThatThrownBy(() -> TimeBucketer.bucketStart(LocalDateTime.of(2022, 4, 4, 9, 15), frequency))
                    .isInstanceOf(InvalidFrequencyException.class)
                    .hasMessageContaining(String.valueOf(frequency));
        }

        @ParameterizedTest
        @ValueSource(longs = {TimeBucketer.MAX_FREQUENCY_SECONDS + 1, Long.MAX_VALUE})
        @DisplayName("rejects frequencies wider than the largest supported bucket")
        void rejectsTooWide(long frequency) {
            assertThatThrownBy(() -> TimeBucketer.bucketStart(LocalDateTime.of(1969, 12, 31, 23, 0), frequency))
                    .isInstanceOf(InvalidFrequencyException.class)
                    .hasMessageContaining(String.valueOf(frequency));
        }

        @Test
        @DisplayName("the widest bucket still floors timestamps on both sides of the epoch")
        void widestBucketIsUsable() {
            long widest = TimeBucketer.MAX_FREQUENCY_SECONDS;

            assertThat(TimeBucketer.bucketStart(LocalDateTime.of(1969, 12, 31, 23, 0), widest))
                    .isEqualTo(LocalDateTime.of(1970, 1, 1, 0, 0).minusSeconds(widest));
            assertThat(TimeBucketer.bucketStart(LocalDateTime.of(1975, 6, 1, 12, 0), widest))
                    .isEqualTo(LocalDateTime.of(1970, 1, 1, 0, 0));
        }
    }
}
