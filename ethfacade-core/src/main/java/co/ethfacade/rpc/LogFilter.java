/*
 * This file is part of EthFacade
 * Copyright (C) 2018 RSK Labs Ltd.
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

import co.ethfacade.core.Address;
import co.ethfacade.core.DataWord;
import co.ethfacade.core.Keccak256;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Criteria of an eth_getLogs query.
 *
 * A null topic position matches any topic. An empty address list matches any address.
 */
@Immutable
public final class LogFilter {

    @Nullable
    private final BlockRef fromBlock;
    @Nullable
    private final BlockRef toBlock;
    @Nullable
    private final Keccak256 blockHash;
    private final List<Address> addresses;
    private final List<List<DataWord>> topics;

    public LogFilter(@Nullable BlockRef fromBlock, @Nullable BlockRef toBlock, @Nullable Keccak256 blockHash,
                     @Nullable List<Address> addresses, @Nullable List<List<DataWord>> topics) {
        this.fromBlock = fromBlock;
        this.toBlock = toBlock;
        this.blockHash = blockHash;
        this.addresses = addresses == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(addresses));
        this.topics = topics == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(topics));
    }

    /**
     * @return the first block to scan, "latest" when omitted.
     */
    public BlockRef getFromBlock() {
        return fromBlock == null ? BlockRef.latest() : fromBlock;
    }

    /**
     * @return the last block to scan, "latest" when omitted.
     */
    public BlockRef getToBlock() {
        return toBlock == null ? BlockRef.latest() : toBlock;
    }

    public boolean hasBlockRange() {
        return fromBlock != null || toBlock != null;
    }

    @Nullable
    public Keccak256 getBlockHash() {
        return blockHash;
    }

    public List<Address> getAddresses() {
        return addresses;
    }

    public List<List<DataWord>> getTopics() {
        return topics;
    }

    public AddressesTopicsFilter toAddressesTopicsFilter() {
        return new AddressesTopicsFilter(addresses, topics);
    }

    @Override
    public String toString() {
        return "LogFilter{" +
                "fromBlock=" + fromBlock +
                ", toBlock=" + toBlock +
                ", blockHash=" + blockHash +
                ", addresses=" + addresses +
                ", topics=" + topics +
                '}';
    }
}
