package io.github.riemr.wave.optimization.constraint;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceTimelineTest {

    private ResourceTimeline timeline;

    @BeforeEach
    void setup() {
        timeline = new ResourceTimeline("W1");
        timeline.occupy(10, 20);
        timeline.occupy(30, 40);
    }

    @Test
    void isFree_treatsIntervalsAsHalfOpen() {
        assertThat(timeline.isFree(0, 10)).isTrue();
        assertThat(timeline.isFree(20, 30)).isTrue();
        assertThat(timeline.isFree(19, 21)).isFalse();
        assertThat(timeline.isFree(5, 45)).isFalse();
        assertThat(timeline.isFree(40, 50)).isTrue();
    }

    @Test
    void earliestFit_findsFirstGapLongEnough() {
        assertThat(timeline.earliestFit(0, 10)).isEqualTo(0);
        assertThat(timeline.earliestFit(0, 11)).isEqualTo(40);
        assertThat(timeline.earliestFit(15, 5)).isEqualTo(20);
        assertThat(timeline.earliestFit(15, 15)).isEqualTo(40);
        assertThat(timeline.earliestFit(45, 100)).isEqualTo(45);
    }

    @Test
    void occupy_rejectsOverlapAndEmptyIntervals() {
        assertThatThrownBy(() -> timeline.occupy(35, 45)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> timeline.occupy(50, 50)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void release_restoresFreeTimeAndRejectsUnknownInterval() {
        timeline.release(30, 40);

        assertThat(timeline.isFree(30, 40)).isTrue();
        assertThat(timeline.nextFreeTime()).isEqualTo(20);
        assertThatThrownBy(() -> timeline.release(10, 15)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void idle_countsGapsBetweenFirstStartAndLastEnd() {
        assertThat(timeline.getBusyMinutes()).isEqualTo(20);
        assertThat(timeline.idleMinutes()).isEqualTo(10);
        // 末尾の後ろに追加すると間隔分増える
        assertThat(timeline.idleDelta(45, 50)).isEqualTo(5);
        // 先頭の前
        assertThat(timeline.idleDelta(0, 5)).isEqualTo(5);
        // 空きに収まると埋めた分だけ減る
        assertThat(timeline.idleDelta(20, 25)).isEqualTo(-5);
        assertThat(new ResourceTimeline("empty").idleDelta(0, 10)).isZero();
    }
}
