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

import java.math.BigInteger;

/**
 * Block header as seen by the facade. Values are supplied by the chain backend and never recomputed.
 */
public class BlockHeader {

    private final long number;
    private final Keccak256 hash;
    private final Keccak256 parentHash;
    private final Keccak256 unclesHash;
    private final Address coinbase;
    private final Keccak256 stateRoot;
    private final Keccak256 txTrieRoot;
    private final Keccak256 receiptTrieRoot;
    private final byte[] logsBloom;
    private final BigInteger difficulty;
    private final BigInteger gasLimit;
    private final long gasUsed;
    private final long timestamp;
    private final byte[] extraData;
    private final Keccak256 mixHash;
    private final byte[] nonce;

    private BlockHeader(Builder builder) {
        this.number = builder.number;
        this.hash = builder.hash;
        this.parentHash = builder.parentHash;
        this.unclesHash = builder.unclesHash;
        this.coinbase = builder.coinbase;
        this.stateRoot = builder.stateRoot;
        this.txTrieRoot = builder.txTrieRoot;
        this.receiptTrieRoot = builder.receiptTrieRoot;
        this.logsBloom = builder.logsBloom;
        this.difficulty = builder.difficulty;
        this.gasLimit = builder.gasLimit;
        this.gasUsed = builder.gasUsed;
        this.timestamp = builder.timestamp;
        this.extraData = builder.extraData;
        this.mixHash = builder.mixHash;
        this.nonce = builder.nonce;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getNumber() {
        return number;
    }

    public Keccak256 getHash() {
        return hash;
    }

    public Keccak256 getParentHash() {
        return parentHash;
    }

    public Keccak256 getUnclesHash() {
        return unclesHash;
    }

    public Address getCoinbase() {
        return coinbase;
    }

    public Keccak256 getStateRoot() {
        return stateRoot;
    }

    public Keccak256 getTxTrieRoot() {
        return txTrieRoot;
    }

    public Keccak256 getReceiptTrieRoot() {
        return receiptTrieRoot;
    }

    public byte[] getLogsBloom() {
        return logsBloom;
    }

    public BigInteger getDifficulty() {
        return difficulty;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public long getGasUsed() {
        return gasUsed;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public byte[] getExtraData() {
        return extraData;
    }

    public Keccak256 getMixHash() {
        return mixHash;
    }

    public byte[] getNonce() {
        return nonce;
    }

    public boolean isGenesis() {
        return number == 0;
    }

    public String getPrintableHash() {
        return hash.toHexString();
    }

    @Override
    public String toString() {
        return "BlockHeader{number=" + number + ", hash=" + hash + '}';
    }

    public static class Builder {
        private long number;
        private Keccak256 hash = Keccak256.ZERO_HASH;
        private Keccak256 parentHash = Keccak256.ZERO_HASH;
        private Keccak256 unclesHash = Keccak256.ZERO_HASH;
        private Address coinbase = new Address(new byte[Address.LENGTH_IN_BYTES]);
        private Keccak256 stateRoot = Keccak256.ZERO_HASH;
        private Keccak256 txTrieRoot = Keccak256.ZERO_HASH;
        private Keccak256 receiptTrieRoot = Keccak256.ZERO_HASH;
        private byte[] logsBloom = new byte[256];
        private BigInteger difficulty = BigInteger.ZERO;
        private BigInteger gasLimit = BigInteger.ZERO;
        private long gasUsed;
        private long timestamp;
        private byte[] extraData = ByteUtil.EMPTY_BYTE_ARRAY;
        private Keccak256 mixHash = Keccak256.ZERO_HASH;
        private byte[] nonce = new byte[8];

        private Builder() {
        }

        public Builder setNumber(long number) {
            this.number = number;
            return this;
        }

        public Builder setHash(Keccak256 hash) {
            this.hash = hash;
            return this;
        }

        public Builder setParentHash(Keccak256 parentHash) {
            this.parentHash = parentHash;
            return this;
        }

        public Builder setUnclesHash(Keccak256 unclesHash) {
            this.unclesHash = unclesHash;
            return this;
        }

        public Builder setCoinbase(Address coinbase) {
            this.coinbase = coinbase;
            return this;
        }

        public Builder setStateRoot(Keccak256 stateRoot) {
            this.stateRoot = stateRoot;
            return this;
        }

        public Builder setTxTrieRoot(Keccak256 txTrieRoot) {
            this.txTrieRoot = txTrieRoot;
            return this;
        }

        public Builder setReceiptTrieRoot(Keccak256 receiptTrieRoot) {
            this.receiptTrieRoot = receiptTrieRoot;
            return this;
        }

        public Builder setLogsBloom(byte[] logsBloom) {
            this.logsBloom = logsBloom;
            return this;
        }

        public Builder setDifficulty(BigInteger difficulty) {
            this.difficulty = difficulty;
            return this;
        }

        public Builder setGasLimit(BigInteger gasLimit) {
            this.gasLimit = gasLimit;
            return this;
        }

        public Builder setGasUsed(long gasUsed) {
            this.gasUsed = gasUsed;
            return this;
        }

        public Builder setTimestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder setExtraData(byte[] extraData) {
            this.extraData = extraData;
            return this;
        }

        public Builder setMixHash(Keccak256 mixHash) {
            this.mixHash = mixHash;
            return this;
        }

        public Builder setNonce(byte[] nonce) {
            this.nonce = nonce;
            return this;
        }

        public BlockHeader build() {
            return new BlockHeader(this);
        }
    }
}
