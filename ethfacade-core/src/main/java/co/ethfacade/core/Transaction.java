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

import javax.annotation.Nullable;
import java.math.BigInteger;

/**
 * A signed transaction, as stored in blocks and in the transaction pool.
 * The receive address is {@link Address#nullAddress()} for contract creation transactions.
 */
public class Transaction {

    private final Keccak256 hash;
    private final BigInteger nonce;
    private final Coin gasPrice;
    private final BigInteger gasLimit;
    private final Address sender;
    private final Address receiveAddress;
    private final Coin value;
    private final byte[] data;
    private final long v;
    private final BigInteger r;
    private final BigInteger s;
    @Nullable
    private final Long chainId;

    private Transaction(Builder builder) {
        this.hash = builder.hash;
        this.nonce = builder.nonce;
        this.gasPrice = builder.gasPrice;
        this.gasLimit = builder.gasLimit;
        this.sender = builder.sender;
        this.receiveAddress = builder.receiveAddress;
        this.value = builder.value;
        this.data = builder.data;
        this.v = builder.v;
        this.r = builder.r;
        this.s = builder.s;
        this.chainId = builder.chainId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Keccak256 getHash() {
        return hash;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public Coin getGasPrice() {
        return gasPrice;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public Address getSender() {
        return sender;
    }

    public Address getReceiveAddress() {
        return receiveAddress;
    }

    public boolean isContractCreation() {
        return Address.nullAddress().equals(receiveAddress);
    }

    public Coin getValue() {
        return value;
    }

    public byte[] getData() {
        return data;
    }

    public long getV() {
        return v;
    }

    public BigInteger getR() {
        return r;
    }

    public BigInteger getS() {
        return s;
    }

    @Nullable
    public Long getChainId() {
        return chainId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        return hash.equals(((Transaction) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "Transaction{hash=" + hash + ", nonce=" + nonce + ", sender=" + sender + ", receiver=" + receiveAddress + '}';
    }

    public static class Builder {
        private Keccak256 hash = Keccak256.ZERO_HASH;
        private BigInteger nonce = BigInteger.ZERO;
        private Coin gasPrice = Coin.ZERO;
        private BigInteger gasLimit = BigInteger.ZERO;
        private Address sender = new Address(new byte[Address.LENGTH_IN_BYTES]);
        private Address receiveAddress = Address.nullAddress();
        private Coin value = Coin.ZERO;
        private byte[] data = ByteUtil.EMPTY_BYTE_ARRAY;
        private long v;
        private BigInteger r = BigInteger.ZERO;
        private BigInteger s = BigInteger.ZERO;
        private Long chainId;

        private Builder() {
        }

        public Builder hash(Keccak256 hash) {
            this.hash = hash;
            return this;
        }

        public Builder nonce(BigInteger nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder gasPrice(Coin gasPrice) {
            this.gasPrice = gasPrice;
            return this;
        }

        public Builder gasLimit(BigInteger gasLimit) {
            this.gasLimit = gasLimit;
            return this;
        }

        public Builder sender(Address sender) {
            this.sender = sender;
            return this;
        }

        public Builder receiveAddress(@Nullable Address receiveAddress) {
            this.receiveAddress = receiveAddress == null ? Address.nullAddress() : receiveAddress;
            return this;
        }

        public Builder value(Coin value) {
            this.value = value;
            return this;
        }

        public Builder data(byte[] data) {
            this.data = data == null ? ByteUtil.EMPTY_BYTE_ARRAY : data;
            return this;
        }

        public Builder signature(long v, BigInteger r, BigInteger s) {
            this.v = v;
            this.r = r;
            this.s = s;
            return this;
        }

        public Builder chainId(@Nullable Long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Transaction build() {
            return new Transaction(this);
        }
    }
}
