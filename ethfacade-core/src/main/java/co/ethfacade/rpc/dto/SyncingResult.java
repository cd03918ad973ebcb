/*
 * This file is part of EthFacade
 * Copyright (C) 2021 RSK Labs Ltd.
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

package co.ethfacade.rpc.dto;

import co.ethfacade.core.SyncStatus;
import co.ethfacade.util.HexUtils;

public class SyncingResult {
    private final String startingBlock;
    private final String currentBlock;
    private final String highestBlock;

    public SyncingResult(SyncStatus status) {
        this.startingBlock = HexUtils.toQuantityJsonHex(status.getStartingBlock());
        this.currentBlock = HexUtils.toQuantityJsonHex(status.getCurrentBlock());
        this.highestBlock = HexUtils.toQuantityJsonHex(status.getHighestBlock());
    }

    public String getStartingBlock() {
        return startingBlock;
    }

    public String getCurrentBlock() {
        return currentBlock;
    }

    public String getHighestBlock() {
        return highestBlock;
    }
}
