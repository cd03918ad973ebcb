/*
 * This file is part of EthFacade
 * Copyright (C) 2017 RSK Labs Ltd.
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

package co.ethfacade.core;

import javax.annotation.concurrent.Immutable;

/**
 * Either "not syncing" or the progress of an ongoing sync.
 */
@Immutable
public final class SyncStatus {

    private static final SyncStatus NOT_SYNCING = new SyncStatus(false, 0, 0, 0);

    private final boolean syncing;
    private final long startingBlock;
    private final long currentBlock;
    private final long highestBlock;

    private SyncStatus(boolean syncing, long startingBlock, long currentBlock, long highestBlock) {
        this.syncing = syncing;
        this.startingBlock = startingBlock;
        this.currentBlock = currentBlock;
        this.highestBlock = highestBlock;
    }

    public static SyncStatus notSyncing() {
        return NOT_SYNCING;
    }

    public static SyncStatus syncing(long startingBlock, long currentBlock, long highestBlock) {
        return new SyncStatus(true, startingBlock, currentBlock, highestBlock);
    }

    public boolean isSyncing() {
        return syncing;
    }

    public long getStartingBlock() {
        return startingBlock;
    }

    public long getCurrentBlock() {
        return currentBlock;
    }

    public long getHighestBlock() {
        return highestBlock;
    }

    @Override
    public String toString() {
        if (!syncing) {
            return "SyncStatus{not syncing}";
        }
        return "SyncStatus{startingBlock=" + startingBlock + ", currentBlock=" + currentBlock + ", highestBlock=" + highestBlock + "}";
    }
}
