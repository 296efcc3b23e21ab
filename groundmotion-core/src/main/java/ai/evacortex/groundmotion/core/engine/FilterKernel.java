/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.engine;

/**
 * {@code FilterKernel} defines the numerical contract of the evolutionary filter model: spectral
 * moments, the model Fourier amplitude spectrum and the Fourier synthesis of realizations.
 *
 * <p>At every time sample {@code i} the process is white noise passed through a high-pass filter
 * (lower frequency {@code wl}, damping {@code zl}) and a low-pass filter (upper frequency
 * {@code wu}, damping {@code zu}):</p>
 * <pre>
 *     H_i(ω) = −ω² / [(wl² − ω² + 2i·zl·wl·ω) · (wu² − ω² + 2i·zu·wu·ω)]
 *     S_i(ω) = |H_i(ω)|²
 * </pre>
 *
 * <p>The moments are rectangle-rule integrals over the analysis axis with step {@code Δω}:</p>
 * <pre>
 *     variance     = Σ S·Δω          variance_bar  = Σ_{ω&gt;0} ω⁻²·S·Δω
 *     variance_dot = Σ ω²·S·Δω       variance_2bar = Σ_{ω&gt;0} ω⁻⁴·S·Δω
 *     variance_2dot = Σ ω⁴·S·Δω
 * </pre>
 *
 * <p>Implementations must be deterministic and free of side effects. Arrays passed in are never
 * modified. Frequencies are angular (rad/s).</p>
 *
 * @see JavaFilterKernel
 * @see FilterEngine
 */
public interface FilterKernel {

    /**
     * Computes the five evolutionary spectral moments.
     *
     * @param wu   upper filter frequency per time sample
     * @param zu   upper filter damping per time sample
     * @param wl   lower filter frequency per time sample
     * @param zl   lower filter damping per time sample
     * @param freq uniform analysis axis starting at 0; a single zero bin yields all-zero moments
     * @return five arrays, each the length of {@code wu}
     * @throws IllegalArgumentException if the filter arrays differ in length
     * @throws NullPointerException     if any argument is {@code null}
     */
    SpectralMoments computeStats(double[] wu, double[] zu, double[] wl, double[] zl, double[] freq);

    /**
     * Computes the Fourier amplitude spectrum of the modulated process,
     * {@code FAS(ω) = sqrt(π·dt·Σ_i mdl_i²·S_i(ω) / variance_i)}, where {@code dt} follows from the
     * axis ({@code Δω = π/(len(freq)·dt)}). Samples with zero variance contribute nothing, and a
     * single zero bin yields a zero spectrum.
     *
     * @return array the length of {@code freq}
     */
    double[] computeFas(double[] mdl, double[] wu, double[] zu, double[] wl, double[] zl, double[] freq);

    /**
     * Builds the one-sided spectra of {@code n} realizations,
     * {@code Y_r(ω) = Σ_i s_i·w[r][i]·H_i(ω)·e^{−iω·t_i}} with
     * {@code s_i = mdl_i·sqrt(π/(dt·variance_i))}, so that the instantaneous standard deviation of
     * the synthesized acceleration follows {@code mdl}.
     *
     * @param n          number of realizations
     * @param npts       number of time samples
     * @param t          time axis
     * @param freqSim    simulation axis, step {@code π/(len(freqSim)·dt)}
     * @param variance   zeroth spectral moment per time sample
     * @param whiteNoise standard normal draws, {@code n × npts}
     * @return spectra of shape {@code n × len(freqSim)}
     * @throws IllegalArgumentException if shapes are inconsistent
     */
    ComplexSpectrum synthesizeSeries(int n, int npts, double[] t, double[] freqSim,
                                     double[] mdl, double[] wu, double[] zu, double[] wl, double[] zl,
                                     double[] variance, double[][] whiteNoise);
}
