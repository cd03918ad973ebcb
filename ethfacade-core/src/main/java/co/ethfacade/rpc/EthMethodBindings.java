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

import co.ethfacade.core.DataWord;
import co.ethfacade.rpc.modules.eth.EthInfoModule;
import co.ethfacade.rpc.modules.eth.EthMiningModule;
import co.ethfacade.rpc.modules.eth.EthReadModule;
import co.ethfacade.rpc.modules.eth.EthWriteModule;
import co.ethfacade.rpc.parameters.BlockHashParam;
import co.ethfacade.rpc.parameters.BlockIdentifierParam;
import co.ethfacade.rpc.parameters.BlockRefParam;
import co.ethfacade.rpc.parameters.CallArgumentsParam;
import co.ethfacade.rpc.parameters.FilterRequestParam;
import co.ethfacade.rpc.parameters.HexAddressParam;
import co.ethfacade.rpc.parameters.HexDataParam;
import co.ethfacade.rpc.parameters.HexHashParam;
import co.ethfacade.rpc.parameters.HexIndexParam;
import co.ethfacade.rpc.parameters.HexNonceParam;
import co.ethfacade.rpc.parameters.HexNumberParam;
import co.ethfacade.rpc.parameters.TxHashParam;
import co.ethfacade.util.ByteUtil;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * Binds every {@link EthMethod} to the module method serving it.
 */
public final class EthMethodBindings {

    private EthMethodBindings() {
    }

    public static Map<EthMethod, EthMethodHandler> bind(EthReadModule read, EthWriteModule write,
                                                         EthMiningModule mining, EthInfoModule info) {
        Map<EthMethod, EthMethodHandler> handlers = new EnumMap<>(EthMethod.class);

        // info
        handlers.put(EthMethod.PROTOCOL_VERSION, p -> completedFuture(info.protocolVersion()));
        handlers.put(EthMethod.CHAIN_ID, p -> completedFuture(info.chainId()));
        handlers.put(EthMethod.ACCOUNTS, p -> completedFuture(info.accounts()));
        handlers.put(EthMethod.GAS_PRICE, p -> completedFuture(info.gasPrice()));
        handlers.put(EthMethod.SYNCING, p -> info.syncing());

        // mining
        handlers.put(EthMethod.HASHRATE, p -> completedFuture(mining.hashrate()));
        handlers.put(EthMethod.COINBASE, p -> completedFuture(mining.coinbase()));
        handlers.put(EthMethod.MINING, p -> completedFuture(mining.mining()));
        handlers.put(EthMethod.GET_WORK, p -> completedFuture(mining.getWork()));
        handlers.put(EthMethod.SUBMIT_WORK, p -> {
            byte[] nonce = p.required(0, HexNonceParam.class).getNonce();
            HexHashParam powHash = p.required(1, HexHashParam.class);
            HexHashParam mixDigest = p.required(2, HexHashParam.class);
            return completedFuture(mining.submitWork(nonce, powHash.getHash(), mixDigest.getHash()));
        });
        handlers.put(EthMethod.SUBMIT_HASHRATE, p -> {
            HexNumberParam rate = p.required(0, HexNumberParam.class);
            HexHashParam clientId = p.required(1, HexHashParam.class);
            return completedFuture(mining.submitHashrate(rate.toBigInteger(), clientId.getHash()));
        });

        // write
        handlers.put(EthMethod.SEND_TRANSACTION, p ->
                write.sendTransaction(p.required(0, CallArgumentsParam.class).toTransactionRequest()));
        handlers.put(EthMethod.SEND_RAW_TRANSACTION, p ->
                write.sendRawTransaction(p.required(0, HexDataParam.class).getRawDataBytes()));
        handlers.put(EthMethod.CALL, p ->
                write.call(p.required(0, CallArgumentsParam.class).toCallRequest(), stateRef(p, 1)));
        handlers.put(EthMethod.ESTIMATE_GAS, p ->
                write.estimateGas(p.required(0, CallArgumentsParam.class).toCallRequest(), stateRef(p, 1)));

        // read
        handlers.put(EthMethod.BLOCK_NUMBER, p -> read.blockNumber());
        handlers.put(EthMethod.GET_BALANCE, p ->
                read.getBalance(p.required(0, HexAddressParam.class).getAddress(), stateRef(p, 1)));
        handlers.put(EthMethod.GET_STORAGE_AT, p -> {
            HexAddressParam address = p.required(0, HexAddressParam.class);
            HexNumberParam key = p.required(1, HexNumberParam.class);
            DataWord storageKey = DataWord.valueOf(ByteUtil.bigIntegerToBytes(key.toBigInteger(), DataWord.BYTES));
            return read.getStorageAt(address.getAddress(), storageKey, stateRef(p, 2));
        });
        handlers.put(EthMethod.GET_TRANSACTION_COUNT, p ->
                read.getTransactionCount(p.required(0, HexAddressParam.class).getAddress(), stateRef(p, 1)));
        handlers.put(EthMethod.GET_CODE, p ->
                read.getCode(p.required(0, HexAddressParam.class).getAddress(), stateRef(p, 1)));
        handlers.put(EthMethod.GET_BLOCK_BY_HASH, p -> {
            BlockHashParam hash = p.required(0, BlockHashParam.class);
            return read.getBlockByHash(hash.getHash(), p.requiredBoolean(1));
        });
        handlers.put(EthMethod.GET_BLOCK_BY_NUMBER, p -> {
            BlockRef ref = blockRef(p, 0);
            return read.getBlockByNumber(ref, p.requiredBoolean(1));
        });
        handlers.put(EthMethod.GET_BLOCK_TRANSACTION_COUNT_BY_HASH, p ->
                read.getBlockTransactionCountByHash(p.required(0, BlockHashParam.class).getHash()));
        handlers.put(EthMethod.GET_BLOCK_TRANSACTION_COUNT_BY_NUMBER, p ->
                read.getBlockTransactionCountByNumber(blockRef(p, 0)));
        handlers.put(EthMethod.GET_UNCLE_COUNT_BY_BLOCK_HASH, p ->
                read.getUncleCountByBlockHash(p.required(0, BlockHashParam.class).getHash()));
        handlers.put(EthMethod.GET_UNCLE_COUNT_BY_BLOCK_NUMBER, p ->
                read.getUncleCountByBlockNumber(blockRef(p, 0)));
        handlers.put(EthMethod.GET_TRANSACTION_BY_HASH, p ->
                read.getTransactionByHash(p.required(0, TxHashParam.class).getHash()));
        handlers.put(EthMethod.GET_TRANSACTION_BY_BLOCK_HASH_AND_INDEX, p -> {
            BlockHashParam hash = p.required(0, BlockHashParam.class);
            return read.getTransactionByBlockHashAndIndex(hash.getHash(), index(p, 1));
        });
        handlers.put(EthMethod.GET_TRANSACTION_BY_BLOCK_NUMBER_AND_INDEX, p -> {
            BlockRef ref = blockRef(p, 0);
            return read.getTransactionByBlockNumberAndIndex(ref, index(p, 1));
        });
        handlers.put(EthMethod.GET_TRANSACTION_RECEIPT, p ->
                read.getTransactionReceipt(p.required(0, TxHashParam.class).getHash()));
        handlers.put(EthMethod.GET_UNCLE_BY_BLOCK_HASH_AND_INDEX, p -> {
            BlockHashParam hash = p.required(0, BlockHashParam.class);
            return read.getUncleByBlockHashAndIndex(hash.getHash(), index(p, 1));
        });
        handlers.put(EthMethod.GET_UNCLE_BY_BLOCK_NUMBER_AND_INDEX, p -> {
            BlockRef ref = blockRef(p, 0);
            return read.getUncleByBlockNumberAndIndex(ref, index(p, 1));
        });
        handlers.put(EthMethod.GET_LOGS, p -> read.getLogs(p.required(0, FilterRequestParam.class).toLogFilter()));

        return Collections.unmodifiableMap(handlers);
    }

    /** Block identifier of state methods: tag, number or EIP-1898 object, latest when omitted. */
    private static BlockRef stateRef(ParamsReader p, int index) {
        return p.optional(index, BlockRefParam.class)
                .map(BlockRefParam::toBlockRef)
                .orElse(BlockRef.latest());
    }

    private static BlockRef blockRef(ParamsReader p, int index) {
        return p.required(index, BlockIdentifierParam.class).toBlockRef();
    }

    private static int index(ParamsReader p, int index) {
        return p.required(index, HexIndexParam.class).getIndex();
    }
}
