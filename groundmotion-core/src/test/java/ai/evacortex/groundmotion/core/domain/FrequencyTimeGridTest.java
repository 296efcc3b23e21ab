/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.domain;

import ai.evacortex.groundmotion.core.exceptions.InvalidGridException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyTimeGridTest {

    @Test
    void axesHaveExpectedLengths() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(500, 0.01);
        assertEquals(500, grid.t().length);
        assertEquals(500, grid.freq().length);
        assertEquals(1024, grid.freqSim().length);
        assertEquals(1024, grid.simulationLength());
        assertEquals(500, grid.freqP2().length);
        assertEquals(500, grid.freqP4().length);
        assertEquals(499, grid.freqN2().length);
        assertEquals(499, grid.freqN4().length);
        assertEquals(1024, grid.freqSimP2().length);
    }

    @Test
    void timeAndFrequencyAxesAreUniform() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(400, 0.005);
        double[] t = grid.t();
        double[] freq = grid.freq();
        assertEquals(0.0, t[0]);
        assertEquals(399 * 0.005, t[399], 1e-12);
        assertEquals(0.0, freq[0]);
        double dw = Math.PI / (400 * 0.005);
        assertEquals(dw, grid.freqStep(), 1e-12);
        assertEquals(dw, freq[1] - freq[0], 1e-12);
        assertTrue(freq[freq.length - 1] < Math.PI / 0.005, "freq must stay below Nyquist");

        double[] sim = grid.freqSim();
        assertEquals(Math.PI / (sim.length * 0.005), sim[1], 1e-12);
    }

    @Test
    void powersMatchAxis() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(64, 0.02);
        double[] freq = grid.freq();
        assertEquals(freq[3] * freq[3], grid.freqP2()[3], 1e-9);
        assertEquals(Math.pow(freq[3], 4), grid.freqP4()[3], 1e-6);
        assertEquals(1.0 / (freq[1] * freq[1]), grid.freqN2()[0], 1e-9);
        assertEquals(Math.pow(freq[5], -4), grid.freqN4()[4], 1e-12);
    }

    @Test
    void invalidConstructionIsRejected() {
        assertThrows(InvalidGridException.class, () -> new FrequencyTimeGrid(0, 0.01));
        assertThrows(InvalidGridException.class, () -> new FrequencyTimeGrid(-5, 0.01));
        assertThrows(InvalidGridException.class, () -> new FrequencyTimeGrid(10, 0.0));
        assertThrows(InvalidGridException.class, () -> new FrequencyTimeGrid(10, Double.NaN));
        assertThrows(InvalidGridException.class, () -> new FrequencyTimeGrid(10, Double.POSITIVE_INFINITY));
    }

    @Test
    void failedAssignmentKeepsPreviousState() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(100, 0.01);
        assertThrows(InvalidGridException.class, () -> grid.setDt(-1.0));
        assertThrows(InvalidGridException.class, () -> grid.setNpts(0));
        assertEquals(100, grid.npts());
        assertEquals(0.01, grid.dt());
        assertEquals(100, grid.t().length);
    }

    @Test
    void mutationRecomputesAxesAndNotifiesListeners() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(100, 0.01);
        AtomicInteger calls = new AtomicInteger();
        grid.addListener(g -> calls.incrementAndGet());
        assertEquals(100, grid.freq().length);

        grid.setNpts(300);
        assertEquals(1, calls.get());
        assertEquals(300, grid.t().length);
        assertEquals(300, grid.freq().length);
        assertEquals(1024, grid.freqSim().length);

        grid.setDt(0.02);
        assertEquals(2, calls.get());
        assertEquals(299 * 0.02, grid.t()[299], 1e-12);
    }

    @Test
    void bandMaskSurvivesGridChanges() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(1000, 0.01);
        grid.setFreqMask(1.0, 10.0);
        grid.setNpts(2000);
        boolean[] mask = grid.freqMask();
        double[] freq = grid.freq();
        assertEquals(freq.length, mask.length);
        for (int i = 0; i < freq.length; i++) {
            double hz = freq[i] / (2 * Math.PI);
            if (hz < 0.999 || hz > 10.001) {
                assertFalse(mask[i], "bin " + i + " (" + hz + " Hz) must be outside the band");
            } else if (hz > 1.001 && hz < 9.999) {
                assertTrue(mask[i], "bin " + i + " (" + hz + " Hz) must be inside the band");
            }
        }
    }

    @Test
    void invalidBandAndPeriodRangesAreRejected() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(100, 0.01);
        assertThrows(InvalidGridException.class, () -> grid.setFreqMask(5.0, 1.0));
        assertThrows(InvalidGridException.class, () -> grid.setFreqMask(-1.0, 1.0));
        assertThrows(InvalidGridException.class, () -> grid.setTp(1.0, 0.5, 0.1));
        assertThrows(InvalidGridException.class, () -> grid.setTp(0.0, 1.0, 0.0));
    }

    @Test
    void periodAxisFollowsRange() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(100, 0.01);
        double[] tp = grid.tp();
        assertEquals(0.04, tp[0], 1e-12);
        assertEquals(0.05, tp[1], 1e-12);

        grid.setTp(0.1, 1.0, 0.1);
        double[] custom = grid.tp();
        assertEquals(9, custom.length);
        assertEquals(0.9, custom[8], 1e-12);
    }

    @Test
    void accessorsReturnCopies() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(128, 0.01);
        double step = grid.freqStep();

        grid.freq()[1] = 0.0;
        grid.t()[5] = -1.0;
        grid.freqSim()[1] = 0.0;
        grid.freqP2()[2] = 0.0;
        grid.freqN2()[0] = 0.0;
        grid.freqMask()[20] = !grid.freqMask()[20];
        grid.tp()[0] = 100.0;

        assertEquals(step, grid.freq()[1], 1e-12);
        assertEquals(0.05, grid.t()[5], 1e-12);
        assertTrue(grid.freqSim()[1] > 0.0);
        assertEquals(4 * step * step, grid.freqP2()[2], 1e-9);
        assertEquals(1.0 / (step * step), grid.freqN2()[0], 1e-9);
        assertEquals(0.04, grid.tp()[0], 1e-12);
        double hz = 20 * step / (2 * Math.PI);
        assertEquals(hz >= 0.1 && hz <= 25.0, grid.freqMask()[20]);
    }

    @Test
    void vetoedChangeKeepsSamplingAndSkipsNotification() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(100, 0.01);
        AtomicInteger calls = new AtomicInteger();
        grid.addListener(new FrequencyTimeGrid.GridListener() {
            @Override
            public void beforeGridChange(FrequencyTimeGrid g, int npts, double dt) {
                if (npts < 50 || dt > 0.05) throw new IllegalStateException("too coarse");
            }

            @Override
            public void onGridChanged(FrequencyTimeGrid g) {
                calls.incrementAndGet();
            }
        });
        grid.addListener(g -> calls.incrementAndGet());

        assertThrows(IllegalStateException.class, () -> grid.setNpts(10));
        assertThrows(IllegalStateException.class, () -> grid.setDt(0.1));

        assertEquals(100, grid.npts());
        assertEquals(0.01, grid.dt());
        assertEquals(100, grid.t().length);
        assertEquals(0, calls.get());

        grid.setNpts(60);
        assertEquals(2, calls.get());
    }

    @Test
    void nptsIsCapped() {
        assertThrows(InvalidGridException.class, () -> new FrequencyTimeGrid(FrequencyTimeGrid.MAX_NPTS + 1, 0.01));
        assertThrows(InvalidGridException.class, () -> new FrequencyTimeGrid(Integer.MAX_VALUE, 0.01));
        FrequencyTimeGrid grid = new FrequencyTimeGrid(100, 0.01);
        assertThrows(InvalidGridException.class, () -> grid.setNpts((1 << 30) + 1));
        assertEquals(100, grid.npts());

        FrequencyTimeGrid largest = new FrequencyTimeGrid(FrequencyTimeGrid.MAX_NPTS, 0.01);
        assertEquals(2 * FrequencyTimeGrid.MAX_NPTS, largest.simulationLength());
    }

    @Test
    void singleSampleGridHasOneBin() {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(1, 0.01);
        assertArrayEquals(new double[]{0.0}, grid.t());
        assertArrayEquals(new double[]{0.0}, grid.freq());
        assertEquals(2, grid.freqSim().length);
        assertEquals(0, grid.freqN2().length);
    }

    @Test
    void nextPowerOfTwo() {
        assertEquals(1, FrequencyTimeGrid.nextPowerOfTwo(1));
        assertEquals(2, FrequencyTimeGrid.nextPowerOfTwo(2));
        assertEquals(4, FrequencyTimeGrid.nextPowerOfTwo(3));
        assertEquals(1024, FrequencyTimeGrid.nextPowerOfTwo(1000));
        assertEquals(1024, FrequencyTimeGrid.nextPowerOfTwo(1024));
        assertEquals(2048, FrequencyTimeGrid.nextPowerOfTwo(1025));
    }
}
