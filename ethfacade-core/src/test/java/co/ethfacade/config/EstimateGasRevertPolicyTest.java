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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EstimateGasRevertPolicyTest {

    @Test
    void parsesConfigValuesIgnoringCase() {
        assertEquals(EstimateGasRevertPolicy.ERROR, EstimateGasRevertPolicy.fromConfigValue("error"));
        assertEquals(EstimateGasRevertPolicy.BEST_EFFORT, EstimateGasRevertPolicy.fromConfigValue("bestEffort"));
        assertEquals(EstimateGasRevertPolicy.BEST_EFFORT, EstimateGasRevertPolicy.fromConfigValue("BESTEFFORT"));
    }

    @Test
    void unknownValueListsTheAcceptedOnes() {
        FacadeConfigurationException e = assertThrows(FacadeConfigurationException.class,
                () -> EstimateGasRevertPolicy.fromConfigValue("cap"));

        assertTrue(e.getMessage().contains("error"));
        assertTrue(e.getMessage().contains("bestEffort"));
    }
}
