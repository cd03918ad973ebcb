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
 * The current proof of work job.
 */
@Immutable
public final class Work {

    private final Keccak256 powHash;
    private final Keccak256 seedHash;
    private final Keccak256 target;

    public Work(Keccak256 powHash, Keccak256 seedHash, Keccak256 target) {
        this.powHash = powHash;
        this.seedHash = seedHash;
        this.target = target;
    }

    public Keccak256 getPowHash() {
        return powHash;
    }

    public Keccak256 getSeedHash() {
        return seedHash;
    }

    /**
     * @return the boundary condition, 2^256 / difficulty.
     */
    public Keccak256 getTarget() {
        return target;
    }
}
