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

import co.ethfacade.util.ByteUtil;

import java.util.Collections;
import java.util.List;

/**
 * A log entry emitted by a contract during transaction execution.
 */
public class LogInfo {

    private final Address address;
    private final List<DataWord> topics;
    private final byte[] data;

    public LogInfo(Address address, List<DataWord> topics, byte[] data) {
        this.address = address;
        this.topics = topics == null ? Collections.emptyList() : Collections.unmodifiableList(topics);
        this.data = data == null ? ByteUtil.EMPTY_BYTE_ARRAY : data;
    }

    public Address getAddress() {
        return address;
    }

    public List<DataWord> getTopics() {
        return topics;
    }

    public byte[] getData() {
        return data;
    }

    @Override
    public String toString() {
        return "LogInfo{" +
                "address=" + address +
                ", topics=" + topics +
                ", data=" + ByteUtil.toHexString(data) +
                '}';
    }
}
