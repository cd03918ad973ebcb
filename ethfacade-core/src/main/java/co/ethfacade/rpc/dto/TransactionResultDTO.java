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

package co.ethfacade.rpc.dto;

import co.ethfacade.core.Block;
import co.ethfacade.core.Coin;
import co.ethfacade.core.Transaction;
import co.ethfacade.util.HexUtils;

/**
 * Transaction object. Block fields are null for pooled transactions and for transactions of the pending block.
 */
public class TransactionResultDTO {

    private final String hash;
    private final String nonce;
    private final String blockHash;
    private final String blockNumber;
    private final String transactionIndex;
    private final String from;
    private final String to;
    private final String gas;
    private final String gasPrice;
    private final String value;
    private final String input;
    private final String chainId;
    private final String v;
    private final String r;
    private final String s;

    public TransactionResultDTO(Block b, Integer index, Transaction tx) {
        hash = tx.getHash().toJsonString();

        nonce = HexUtils.toQuantityJsonHex(tx.getNonce());

        blockHash = b != null ? b.getHashJsonString() : null;
        blockNumber = b != null ? HexUtils.toQuantityJsonHex(b.getNumber()) : null;
        transactionIndex = b != null && index != null ? HexUtils.toQuantityJsonHex(index) : null;

        from = tx.getSender().toJsonString();
        to = tx.getReceiveAddress().toJsonString();
        gas = HexUtils.toQuantityJsonHex(tx.getGasLimit());

        gasPrice = HexUtils.toQuantityJsonHex(tx.getGasPrice().asBigInteger());

        if (Coin.ZERO.equals(tx.getValue())) {
            value = "0x0";
        } else {
            value = HexUtils.toQuantityJsonHex(tx.getValue().asBigInteger());
        }

        input = HexUtils.toUnformattedJsonHex(tx.getData());

        chainId = tx.getChainId() != null ? HexUtils.toQuantityJsonHex(tx.getChainId()) : null;

        v = HexUtils.toQuantityJsonHex(tx.getV());
        r = HexUtils.toQuantityJsonHex(tx.getR());
        s = HexUtils.toQuantityJsonHex(tx.getS());
    }

    public static TransactionResultDTO pooled(Transaction tx) {
        return new TransactionResultDTO(null, null, tx);
    }

    public String getHash() {
        return hash;
    }

    public String getNonce() {
        return nonce;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public String getBlockNumber() {
        return blockNumber;
    }

    public String getTransactionIndex() {
        return transactionIndex;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public String getGas() {
        return gas;
    }

    public String getGasPrice() {
        return gasPrice;
    }

    public String getValue() {
        return value;
    }

    public String getInput() {
        return input;
    }

    public String getChainId() {
        return chainId;
    }

    public String getV() {
        return v;
    }

    public String getR() {
        return r;
    }

    public String getS() {
        return s;
    }
}
