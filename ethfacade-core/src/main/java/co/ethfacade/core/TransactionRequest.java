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

package co.ethfacade.core;

import co.ethfacade.util.ByteUtil;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.math.BigInteger;

/**
 * A transaction to be completed, signed by the node and submitted to the pool.
 * Only the sender is mandatory.
 */
@Immutable
public final class TransactionRequest {

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
    @Nullable
    private final BigInteger nonce;
    @Nullable
    private final Long chainId;

    public TransactionRequest(Address from, @Nullable Address to, @Nullable BigInteger gas, @Nullable Coin gasPrice,
                              @Nullable Coin value, @Nullable byte[] data, @Nullable BigInteger nonce,
                              @Nullable Long chainId) {
        this.from = from;
        this.to = to;
        this.gas = gas;
        this.gasPrice = gasPrice;
        this.value = value;
        this.data = data == null ? ByteUtil.EMPTY_BYTE_ARRAY : ByteUtil.cloneBytes(data);
        this.nonce = nonce;
        this.chainId = chainId;
    }

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

    @Nullable
    public BigInteger getNonce() {
        return nonce;
    }

    @Nullable
    public Long getChainId() {
        return chainId;
    }

    /**
     * @return true when every field the signer needs has a value.
     */
    public boolean isComplete() {
        return gas != null && gasPrice != null && nonce != null;
    }

    public TransactionRequest withNonce(BigInteger newNonce) {
        return new TransactionRequest(from, to, gas, gasPrice, value, data, newNonce, chainId);
    }

    public TransactionRequest withGasPrice(Coin newGasPrice) {
        return new TransactionRequest(from, to, gas, newGasPrice, value, data, nonce, chainId);
    }

    public TransactionRequest withGas(BigInteger newGas) {
        return new TransactionRequest(from, to, newGas, gasPrice, value, data, nonce, chainId);
    }

    public TransactionRequest withChainId(@Nullable Long newChainId) {
        return new TransactionRequest(from, to, gas, gasPrice, value, data, nonce, newChainId);
    }

    /**
     * @return the call used to estimate the gas of this transaction.
     */
    public CallRequest toCallRequest() {
        return new CallRequest(from, to, gas, gasPrice, value, data);
    }

    @Override
    public String toString() {
        return "TransactionRequest{" +
                "from=" + from +
                ", to=" + to +
                ", gas=" + gas +
                ", gasPrice=" + gasPrice +
                ", value=" + value +
                ", nonce=" + nonce +
                ", chainId=" + chainId +
                '}';
    }
}
