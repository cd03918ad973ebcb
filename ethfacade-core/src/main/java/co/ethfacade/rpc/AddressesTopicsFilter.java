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

package co.ethfacade.rpc;

import co.ethfacade.core.Address;
import co.ethfacade.core.DataWord;
import co.ethfacade.core.LogInfo;

import java.util.List;

/**
 * Matches logs by emitting address and by positional topics.
 * Topics: [[A, B], null, [C]] means (A or B) at position 0, anything at 1 and C at 2.
 */
public class AddressesTopicsFilter {
    private final List<List<DataWord>> topics;
    private final List<Address> addresses;

    public AddressesTopicsFilter(List<Address> addresses, List<List<DataWord>> topics) {
        this.addresses = addresses;
        this.topics = topics;
    }

    boolean matchesContractAddress(Address logAddress) {
        return addresses.isEmpty() || addresses.contains(logAddress);
    }

    public boolean matchesExactly(LogInfo logInfo) {
        if (!matchesContractAddress(logInfo.getAddress())) {
            return false;
        }

        List<DataWord> logTopics = logInfo.getTopics();

        for (int i = 0; i < this.topics.size(); i++) {
            if (i >= logTopics.size()) {
                return false;
            }

            List<DataWord> orTopics = topics.get(i);

            if (orTopics != null && !orTopics.isEmpty() && !orTopics.contains(logTopics.get(i))) {
                return false;
            }
        }

        return true;
    }
}
