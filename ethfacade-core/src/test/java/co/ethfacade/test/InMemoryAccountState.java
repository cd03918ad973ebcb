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

package co.ethfacade.test;

import co.ethfacade.backend.AccountStateSnapshot;
import co.ethfacade.core.Address;
import co.ethfacade.core.Coin;
import co.ethfacade.core.DataWord;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable account state. Every {@code with*} call returns a new snapshot.
 */
public class InMemoryAccountState implements AccountStateSnapshot {

    private static final InMemoryAccountState EMPTY = new InMemoryAccountState(
            Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap());

    private final Map<Address, Coin> balances;
    private final Map<Address, BigInteger> nonces;
    private final Map<Address, byte[]> codes;
    private final Map<Address, Map<DataWord, DataWord>> storage;

    private InMemoryAccountState(Map<Address, Coin> balances, Map<Address, BigInteger> nonces,
                                 Map<Address, byte[]> codes, Map<Address, Map<DataWord, DataWord>> storage) {
        this.balances = balances;
        this.nonces = nonces;
        this.codes = codes;
        this.storage = storage;
    }

    public static InMemoryAccountState empty() {
        return EMPTY;
    }

    public InMemoryAccountState withBalance(Address address, Coin balance) {
        Map<Address, Coin> copy = new HashMap<>(balances);
        copy.put(address, balance);
        return new InMemoryAccountState(copy, nonces, codes, storage);
    }

    public InMemoryAccountState withNonce(Address address, long nonce) {
        Map<Address, BigInteger> copy = new HashMap<>(nonces);
        copy.put(address, BigInteger.valueOf(nonce));
        return new InMemoryAccountState(balances, copy, codes, storage);
    }

    public InMemoryAccountState withCode(Address address, byte[] code) {
        Map<Address, byte[]> copy = new HashMap<>(codes);
        copy.put(address, code.clone());
        return new InMemoryAccountState(balances, nonces, copy, storage);
    }

    public InMemoryAccountState withStorage(Address address, DataWord key, DataWord value) {
        Map<Address, Map<DataWord, DataWord>> copy = new HashMap<>(storage);
        Map<DataWord, DataWord> accountStorage = new HashMap<>(storage.getOrDefault(address, Collections.emptyMap()));
        accountStorage.put(key, value);
        copy.put(address, accountStorage);
        return new InMemoryAccountState(balances, nonces, codes, copy);
    }

    @Override
    public Coin getBalance(Address address) {
        return balances.get(address);
    }

    @Override
    public BigInteger getNonce(Address address) {
        return nonces.get(address);
    }

    @Override
    public byte[] getCode(Address address) {
        byte[] code = codes.get(address);
        return code == null ? null : code.clone();
    }

    @Override
    public DataWord getStorageValue(Address address, DataWord key) {
        Map<DataWord, DataWord> accountStorage = storage.get(address);
        return accountStorage == null ? null : accountStorage.get(key);
    }
}
