/*
 * This file is part of EthFacade
 * Copyright (C) 2019 RSK Labs Ltd.
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

import co.ethfacade.backend.AccountStateSnapshot;
import co.ethfacade.backend.ChainHistory;
import co.ethfacade.backend.ChainState;
import co.ethfacade.core.Block;
import co.ethfacade.core.Keccak256;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.resolutionError;
import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.stateNotFound;

/**
 * Resolves client block identifiers against the chain backend:
 * <p>
 * HEX String  - an integer block number on the canonical chain
 * HASH        - a block hash, only if the block is canonical
 * "earliest"  - the genesis block, while it is retained
 * "latest"    - the canonical head, read once per resolution
 * "pending"   - the pending block/state, or the latest one when the backend has none
 */
public class BlockRefResolver {

    private static final Logger logger = LoggerFactory.getLogger("blockresolver");

    private final ChainHistory chainHistory;
    private final ChainState chainState;

    public BlockRefResolver(ChainHistory chainHistory, ChainState chainState) {
        this.chainHistory = chainHistory;
        this.chainState = chainState;
    }

    /**
     * Retrieves the block denoted by the reference.
     * @return An optional containing the block if found.
     * @throws EthJsonRpcRequestException if "earliest" was requested but genesis is no longer retained.
     */
    public Optional<Block> resolveBlock(BlockRef ref) {
        switch (ref.getKind()) {
            case LATEST:
                return Optional.of(chainHistory.getBestBlock());
            case PENDING:
                Optional<Block> pendingBlock = chainHistory.getPendingBlock();
                if (pendingBlock.isPresent()) {
                    return pendingBlock;
                }
                logger.trace("No pending block available, falling back to latest");
                return Optional.of(chainHistory.getBestBlock());
            case EARLIEST:
                requireGenesisRetained();
                return chainHistory.getBlockByNumber(0);
            case HASH:
                return getCanonicalBlockByHash(ref.getHash());
            case NUMBER:
            default:
                if (isBelowLowestRetained(ref.getNumber())) {
                    return Optional.empty();
                }
                return getCanonicalBlockByNumber(ref.getNumber());
        }
    }

    /**
     * Retrieves the block denoted by the reference together with its state snapshot.
     * @return An optional containing the resolved state, empty if the block does not exist.
     * @throws EthJsonRpcRequestException if the block exists but its state is not available.
     */
    public Optional<ResolvedState> resolveState(BlockRef ref) {
        if (ref.isPending()) {
            Optional<ResolvedState> pendingState = resolvePendingState();
            if (pendingState.isPresent()) {
                return pendingState;
            }
            return resolveState(BlockRef.latest());
        }

        if (ref.getKind() == BlockRef.Kind.NUMBER && isBelowLowestRetained(ref.getNumber())) {
            throw resolutionError(String.format("State for block %s is no longer retained", ref));
        }

        Optional<Block> optBlock = resolveBlock(ref);
        if (!optBlock.isPresent()) {
            return Optional.empty();
        }

        Block block = optBlock.get();
        AccountStateSnapshot snapshot = chainState.snapshotAt(block.getHeader()).orElseThrow(() ->
                stateNotFound(String.format("State not found for block with hash %s", block.getHash())));

        return Optional.of(new ResolvedState(block, snapshot, false));
    }

    /**
     * @return true if the block is the one the canonical chain holds at its height.
     */
    public boolean isCanonical(Block block) {
        return chainHistory.getBlockByNumber(block.getNumber())
                .map(canonical -> canonical.getHash().equals(block.getHash()))
                .orElse(false);
    }

    public long getLowestRetainedNumber() {
        return chainHistory.getLowestRetainedNumber();
    }

    private Optional<ResolvedState> resolvePendingState() {
        Optional<Block> pendingBlock = chainHistory.getPendingBlock();
        if (!pendingBlock.isPresent()) {
            return Optional.empty();
        }

        return chainState.getPendingSnapshot()
                .map(snapshot -> new ResolvedState(pendingBlock.get(), snapshot, true));
    }

    private Optional<Block> getCanonicalBlockByHash(Keccak256 hash) {
        return chainHistory.getBlockByHash(hash).filter(this::isCanonical);
    }

    private Optional<Block> getCanonicalBlockByNumber(long number) {
        Block best = chainHistory.getBestBlock();
        if (Long.compareUnsigned(number, best.getNumber()) > 0) {
            return Optional.empty();
        }

        return chainHistory.getBlockByNumber(number);
    }

    private boolean isBelowLowestRetained(long number) {
        return Long.compareUnsigned(number, chainHistory.getLowestRetainedNumber()) < 0;
    }

    private void requireGenesisRetained() {
        long lowest = chainHistory.getLowestRetainedNumber();
        if (lowest > 0) {
            throw resolutionError(String.format("History before block %d has been pruned, earliest block is not available", lowest));
        }
    }
}
