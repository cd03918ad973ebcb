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

package co.ethfacade.rpc;

import co.ethfacade.backend.AccountStateSnapshot;
import co.ethfacade.core.Block;

import javax.annotation.concurrent.Immutable;

/**
 * A block and the state right after it, bound once when a call resolves its block identifier.
 * Every read in the call goes through this handle, so concurrent head changes are not observed.
 */
@Immutable
public final class ResolvedState {

    private final Block block;
    private final AccountStateSnapshot state;
    private final boolean pending;

    public ResolvedState(Block block, AccountStateSnapshot state, boolean pending) {
        this.block = block;
        this.state = state;
        this.pending = pending;
    }

    public Block getBlock() {
        return block;
    }

    public AccountStateSnapshot getState() {
        return state;
    }

    public boolean isPending() {
        return pending;
    }
}
