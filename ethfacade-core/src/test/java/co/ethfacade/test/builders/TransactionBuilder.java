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

package co.ethfacade.test.builders;

import co.ethfacade.core.Address;
import co.ethfacade.core.Coin;
import co.ethfacade.core.Transaction;
import co.ethfacade.crypto.HashUtil;
import co.ethfacade.util.ByteUtil;
import com.google.common.primitives.Bytes;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

public class TransactionBuilder {
    private Address sender = new Address("0x0000000000000000000000000000000000000001");
    private Address receiver = new Address("0x0000000000000000000000000000000000000002");
    private BigInteger nonce = BigInteger.ZERO;
    private BigInteger gasLimit = BigInteger.valueOf(21000);
    private Coin gasPrice = Coin.valueOf(1);
    private Coin value = Coin.ZERO;
    private byte[] data = ByteUtil.EMPTY_BYTE_ARRAY;
    private Long chainId = 33L;

    public TransactionBuilder sender(Address sender) {
        this.sender = sender;
        return this;
    }

    public TransactionBuilder receiver(Address receiver) {
        this.receiver = receiver;
        return this;
    }

    public TransactionBuilder nonce(long nonce) {
        this.nonce = BigInteger.valueOf(nonce);
        return this;
    }

    public TransactionBuilder gasLimit(long gasLimit) {
        this.gasLimit = BigInteger.valueOf(gasLimit);
        return this;
    }

    public TransactionBuilder gasPrice(long gasPrice) {
        this.gasPrice = Coin.valueOf(gasPrice);
        return this;
    }

    public TransactionBuilder value(long value) {
        this.value = Coin.valueOf(value);
        return this;
    }

    public TransactionBuilder data(byte[] data) {
        this.data = data;
        return this;
    }

    public TransactionBuilder chainId(Long chainId) {
        this.chainId = chainId;
        return this;
    }

    public Transaction build() {
        byte[] seed = ByteBuffer.allocate(64)
                .put(sender.getBytes())
                .put(receiver == null ? new byte[Address.LENGTH_IN_BYTES] : receiver.getBytes())
                .putLong(nonce.longValue())
                .putLong(value.asBigInteger().longValue())
                .array();
        byte[] hashInput = Bytes.concat(seed, data, String.valueOf(chainId).getBytes(StandardCharsets.UTF_8));

        return Transaction.builder()
                .hash(HashUtil.keccak256Hash(hashInput))
                .sender(sender)
                .receiveAddress(receiver)
                .nonce(nonce)
                .gasLimit(gasLimit)
                .gasPrice(gasPrice)
                .value(value)
                .data(data)
                .signature(27, BigInteger.ONE, BigInteger.TEN)
                .chainId(chainId)
                .build();
    }
}
