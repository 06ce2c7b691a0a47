package com.streetpano.depth;

import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;

class DepthRendererTest {

    private static int bgrAt(Mat mat, int x, int y) {
        UByteIndexer idx = mat.createIndexer();
        int v = (idx.get(y, x, 0) << 16) | (idx.get(y, x, 1) << 8) | idx.get(y, x, 2);
        idx.release();
        return v;
    }

    @Test
    void rendersAtFieldSizeWithBlackNoData() {
        DistanceField field = new DistanceField(3, 2, new double[]{1, 2, Double.NaN, 4, 5, 6});

        Mat img = DepthRenderer.render(field);

        assertThat(img.cols()).isEqualTo(3);
        assertThat(img.rows()).isEqualTo(2);
        assertThat(img.type()).isEqualTo(CV_8UC3);
        assertThat(bgrAt(img, 2, 0)).isZero();
        assertThat(bgrAt(img, 0, 0)).isNotEqualTo(bgrAt(img, 2, 1));
    }

    @Test
    void equalDistancesShareOneColour() {
        DistanceField field = new DistanceField(2, 2, new double[]{7, 7, 7, 7});

        Mat img = DepthRenderer.render(field);

        assertThat(bgrAt(img, 0, 0)).isEqualTo(bgrAt(img, 1, 1));
    }

    @Test
    void allNoDataRendersBlack() {
        DistanceField field = new DistanceField(2, 1, new double[]{Double.NaN, Double.NaN});

        Mat img = DepthRenderer.render(field);

        assertThat(bgrAt(img, 0, 0)).isZero();
        assertThat(bgrAt(img, 1, 0)).isZero();
    }

    @Test
    void resizeUsesNearestNeighbour() {
        DistanceField field = new DistanceField(2, 1, new double[]{1, 10});
        Mat small = DepthRenderer.render(field);
        int left = bgrAt(small, 0, 0);
        int right = bgrAt(small, 1, 0);

        Mat big = DepthRenderer.render(field, 8, 4);

        assertThat(big.cols()).isEqualTo(8);
        assertThat(big.rows()).isEqualTo(4);
        Set<Integer> colours = new HashSet<>();
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 8; x++) {
                colours.add(bgrAt(big, x, y));
            }
        }
        assertThat(colours).containsExactlyInAnyOrder(left, right);
        assertThat(bgrAt(big, 0, 0)).isEqualTo(left);
        assertThat(bgrAt(big, 7, 3)).isEqualTo(right);
    }

    @Test
    void rendersAtPanoramaSizeForZoom() {
        DistanceField field = new DistanceField(4, 2, new double[]{1, 2, 3, 4, 5, 6, 7, 8});

        Mat img = DepthRenderer.renderForZoom(field, 0);

        assertThat(img.cols()).isEqualTo(417);
        assertThat(img.rows()).isEqualTo(208);
    }

    @Test
    void rejectsNonPositiveTargetSize() {
        DistanceField field = new DistanceField(1, 1, new double[]{1});

        assertThatThrownBy(() -> DepthRenderer.render(field, 0, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
