/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.engine;

import org.junit.jupiter.api.DisplayName;

@DisplayName("JavaFilterKernel contract")
class JavaFilterKernelContractTest extends FilterKernelContractTest {

    private static final FilterKernel KERNEL = new JavaFilterKernel();

    @Override
    protected FilterKernel kernel() {
        return KERNEL;
    }
}
