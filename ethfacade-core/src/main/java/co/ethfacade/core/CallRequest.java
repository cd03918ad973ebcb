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

package co.ethfacade.core;

import co.ethfacade.util.ByteUtil;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.math.BigInteger;

/**
 * A message call to execute in a discarded sandbox. Every field is optional.
 */
@Immutable
public final class CallRequest {

    @Nullable
    private final Address from;
    @Nullable
    private final Address to;
    @Nullable
    private final BigInteger gas;
    @Nullable
    private final Coin gasPrice;
    @Nullable
    private final Coin value;
    private final byte[] data;

    public CallRequest(@Nullable Address from, @Nullable Address to, @Nullable BigInteger gas,
                       @Nullable Coin gasPrice, @Nullable Coin value, @Nullable byte[] data) {
        this.from = from;
        this.to = to;
        this.gas = gas;
        this.gasPrice = gasPrice;
        this.value = value;
        this.data = data == null ? ByteUtil.EMPTY_BYTE_ARRAY : ByteUtil.cloneBytes(data);
    }

    @Nullable
    public Address getFrom() {
        return from;
    }

    @Nullable
    public Address getTo() {
        return to;
    }

    @Nullable
    public BigInteger getGas() {
        return gas;
    }

    @Nullable
    public Coin getGasPrice() {
        return gasPrice;
    }

    @Nullable
    public Coin getValue() {
        return value;
    }

    public byte[] getData() {
        return ByteUtil.cloneBytes(data);
    }

    /**
     * @return a copy of this call with the given gas limit.
     */
    public CallRequest withGas(BigInteger newGas) {
        return new CallRequest(from, to, newGas, gasPrice, value, data);
    }

    @Override
    public String toString() {
        return "CallRequest{" +
                "from=" + from +
                ", to=" + to +
                ", gas=" + gas +
                ", gasPrice=" + gasPrice +
                ", value=" + value +
                ", data=" + ByteUtil.toHexString(data) +
                '}';
    }
}
