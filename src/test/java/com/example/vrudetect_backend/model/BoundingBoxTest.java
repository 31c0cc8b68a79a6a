package com.example.vrudetect_backend.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BoundingBoxTest {

    @Test
    void iouOfIdenticalBoxesIsOne() {
        var box = new BoundingBox(10, 10, 50, 80);
        assertThat(box.iou(box)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void iouOfShiftedBoxes() {
        var a = new BoundingBox(0, 0, 100, 100);
        var b = new BoundingBox(25, 0, 100, 100);

        assertThat(a.iou(b)).isCloseTo(0.6, within(1e-9));
        assertThat(b.iou(a)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void disjointOrEmptyBoxesHaveNoOverlap() {
        var a = new BoundingBox(0, 0, 10, 10);

        assertThat(a.iou(new BoundingBox(20, 20, 10, 10))).isZero();
        assertThat(a.iou(new BoundingBox(0, 0, 0, 0))).isZero();
        assertThat(a.iou(null)).isZero();
    }

    @Test
    void negativeSizesAreClamped() {
        var box = new BoundingBox(5, 5, -3, -1);
        assertThat(box.width()).isZero();
        assertThat(box.area()).isZero();
    }

    @Test
    void histogramBucketsByConfidence() {
        ConfidenceHistogram h = ConfidenceHistogram.empty()
                .add(0.95).add(0.81).add(0.8).add(0.5).add(0.49);

        assertThat(h.high()).isEqualTo(2);
        assertThat(h.medium()).isEqualTo(2);
        assertThat(h.low()).isEqualTo(1);
        assertThat(h.total()).isEqualTo(5);
    }
}
