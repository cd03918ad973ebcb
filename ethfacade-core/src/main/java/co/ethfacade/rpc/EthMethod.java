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

package co.ethfacade.rpc;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The eth_* methods served by the facade, with the properties the router needs to dispatch them:
 * the module group, whether the call suspends on backend I/O, what a missing result means and the
 * accepted number of positional parameters.
 */
public enum EthMethod {
    PROTOCOL_VERSION("eth_protocolVersion", Group.INFO, Suspension.IMMEDIATE, ResultShape.REQUIRED, 0, 0),
    HASHRATE("eth_hashrate", Group.MINING, Suspension.IMMEDIATE, ResultShape.REQUIRED, 0, 0),
    CHAIN_ID("eth_chainId", Group.INFO, Suspension.IMMEDIATE, ResultShape.OPTIONAL, 0, 0),
    ACCOUNTS("eth_accounts", Group.INFO, Suspension.IMMEDIATE, ResultShape.REQUIRED, 0, 0),
    GET_BALANCE("eth_getBalance", Group.READ, Suspension.SUSPENDING, ResultShape.REQUIRED, 1, 2),
    SEND_TRANSACTION("eth_sendTransaction", Group.WRITE, Suspension.SUSPENDING, ResultShape.REQUIRED, 1, 1),
    CALL("eth_call", Group.WRITE, Suspension.SUSPENDING, ResultShape.REQUIRED, 1, 2),
    SYNCING("eth_syncing", Group.INFO, Suspension.SUSPENDING, ResultShape.REQUIRED, 0, 0),
    COINBASE("eth_coinbase", Group.MINING, Suspension.IMMEDIATE, ResultShape.REQUIRED, 0, 0),
    MINING("eth_mining", Group.MINING, Suspension.IMMEDIATE, ResultShape.REQUIRED, 0, 0),
    GAS_PRICE("eth_gasPrice", Group.INFO, Suspension.IMMEDIATE, ResultShape.REQUIRED, 0, 0),
    BLOCK_NUMBER("eth_blockNumber", Group.READ, Suspension.SUSPENDING, ResultShape.REQUIRED, 0, 0),
    GET_STORAGE_AT("eth_getStorageAt", Group.READ, Suspension.SUSPENDING, ResultShape.REQUIRED, 2, 3),
    GET_BLOCK_BY_HASH("eth_getBlockByHash", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 2, 2),
    GET_BLOCK_BY_NUMBER("eth_getBlockByNumber", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 2, 2),
    GET_TRANSACTION_COUNT("eth_getTransactionCount", Group.READ, Suspension.SUSPENDING, ResultShape.REQUIRED, 1, 2),
    GET_BLOCK_TRANSACTION_COUNT_BY_HASH("eth_getBlockTransactionCountByHash", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 1, 1),
    GET_BLOCK_TRANSACTION_COUNT_BY_NUMBER("eth_getBlockTransactionCountByNumber", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 1, 1),
    GET_UNCLE_COUNT_BY_BLOCK_HASH("eth_getUncleCountByBlockHash", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 1, 1),
    GET_UNCLE_COUNT_BY_BLOCK_NUMBER("eth_getUncleCountByBlockNumber", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 1, 1),
    GET_CODE("eth_getCode", Group.READ, Suspension.SUSPENDING, ResultShape.REQUIRED, 1, 2),
    SEND_RAW_TRANSACTION("eth_sendRawTransaction", Group.WRITE, Suspension.SUSPENDING, ResultShape.REQUIRED, 1, 1),
    ESTIMATE_GAS("eth_estimateGas", Group.WRITE, Suspension.SUSPENDING, ResultShape.REQUIRED, 1, 2),
    GET_TRANSACTION_BY_HASH("eth_getTransactionByHash", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 1, 1),
    GET_TRANSACTION_BY_BLOCK_HASH_AND_INDEX("eth_getTransactionByBlockHashAndIndex", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 2, 2),
    GET_TRANSACTION_BY_BLOCK_NUMBER_AND_INDEX("eth_getTransactionByBlockNumberAndIndex", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 2, 2),
    GET_TRANSACTION_RECEIPT("eth_getTransactionReceipt", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 1, 1),
    GET_UNCLE_BY_BLOCK_HASH_AND_INDEX("eth_getUncleByBlockHashAndIndex", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 2, 2),
    GET_UNCLE_BY_BLOCK_NUMBER_AND_INDEX("eth_getUncleByBlockNumberAndIndex", Group.READ, Suspension.SUSPENDING, ResultShape.OPTIONAL, 2, 2),
    GET_LOGS("eth_getLogs", Group.READ, Suspension.SUSPENDING, ResultShape.REQUIRED, 1, 1),
    GET_WORK("eth_getWork", Group.MINING, Suspension.IMMEDIATE, ResultShape.REQUIRED, 0, 0),
    SUBMIT_WORK("eth_submitWork", Group.MINING, Suspension.IMMEDIATE, ResultShape.REQUIRED, 3, 3),
    SUBMIT_HASHRATE("eth_submitHashrate", Group.MINING, Suspension.IMMEDIATE, ResultShape.REQUIRED, 2, 2);

    public enum Group { READ, WRITE, MINING, INFO }

    /** SUSPENDING methods touch the backend and run on the worker pool under the call timeout. */
    public enum Suspension { SUSPENDING, IMMEDIATE }

    /** What a null module result becomes on the wire. */
    public enum ResultShape {
        /** JSON null. */
        OPTIONAL,
        /** A resource not found error. */
        REQUIRED
    }

    private static final Map<String, EthMethod> BY_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(EthMethod::getName, Function.identity())));

    private final String name;
    private final Group group;
    private final Suspension suspension;
    private final ResultShape resultShape;
    private final int minParams;
    private final int maxParams;

    EthMethod(String name, Group group, Suspension suspension, ResultShape resultShape, int minParams, int maxParams) {
        this.name = name;
        this.group = group;
        this.suspension = suspension;
        this.resultShape = resultShape;
        this.minParams = minParams;
        this.maxParams = maxParams;
    }

    public static Optional<EthMethod> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String getName() {
        return name;
    }

    public Group getGroup() {
        return group;
    }

    public Suspension getSuspension() {
        return suspension;
    }

    public boolean isSuspending() {
        return suspension == Suspension.SUSPENDING;
    }

    public ResultShape getResultShape() {
        return resultShape;
    }

    public int getMinParams() {
        return minParams;
    }

    public int getMaxParams() {
        return maxParams;
    }

    public boolean acceptsParamCount(int count) {
        return count >= minParams && count <= maxParams;
    }
}
