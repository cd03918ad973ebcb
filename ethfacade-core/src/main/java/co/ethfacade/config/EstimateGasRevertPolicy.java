/*
 * This file is part of EthFacade
 * Copyright (C) 2026 EthFacade contributors
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */

package co.ethfacade.config;

import java.util.Arrays;

/**
 * What eth_estimateGas answers when the call reverts at the gas cap.
 */
public enum EstimateGasRevertPolicy {
    /** Report the revert as an execution error carrying the revert data. */
    ERROR("error"),
    /** Answer with the gas cap. */
    BEST_EFFORT("bestEffort");

    private final String configValue;

    EstimateGasRevertPolicy(String configValue) {
        this.configValue = configValue;
    }

    public String getConfigValue() {
        return configValue;
    }

    public static EstimateGasRevertPolicy fromConfigValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.configValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new FacadeConfigurationException(
                        String.format("Unknown estimateGas revert policy '%s', expected one of %s", value,
                                Arrays.toString(Arrays.stream(values()).map(EstimateGasRevertPolicy::getConfigValue).toArray()))));
    }
}
