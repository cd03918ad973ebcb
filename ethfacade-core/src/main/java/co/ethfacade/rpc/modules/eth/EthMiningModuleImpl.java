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

package co.ethfacade.rpc.modules.eth;

import co.ethfacade.backend.MiningCoordinator;
import co.ethfacade.core.Keccak256;
import co.ethfacade.core.Work;
import co.ethfacade.util.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

public class EthMiningModuleImpl implements EthMiningModule {

    private static final Logger logger = LoggerFactory.getLogger("web3");

    private final MiningCoordinator miningCoordinator;

    public EthMiningModuleImpl(MiningCoordinator miningCoordinator) {
        this.miningCoordinator = miningCoordinator;
    }

    @Override
    public String hashrate() {
        String s = null;
        try {
            s = HexUtils.toQuantityJsonHex(miningCoordinator.getHashrate());
            return s;
        } finally {
            logger.debug("eth_hashrate(): {}", s);
        }
    }

    @Override
    public boolean submitHashrate(BigInteger hashrate, Keccak256 clientId) {
        boolean accepted = miningCoordinator.submitHashrate(hashrate, clientId);
        logger.debug("eth_submitHashrate({}, {}): {}", hashrate, clientId, accepted);
        return accepted;
    }

    @Override
    public String[] getWork() {
        String[] s = null;
        try {
            Optional<Work> work = miningCoordinator.getWork();
            if (!work.isPresent()) {
                return null;
            }

            s = new String[] {
                    work.get().getPowHash().toJsonString(),
                    work.get().getSeedHash().toJsonString(),
                    work.get().getTarget().toJsonString()
            };
            return s;
        } finally {
            if (logger.isDebugEnabled()) {
                logger.debug("eth_getWork(): {}", Arrays.toString(s));
            }
        }
    }

    @Override
    public boolean submitWork(byte[] nonce, Keccak256 powHash, Keccak256 mixDigest) {
        boolean accepted = miningCoordinator.submitWork(nonce, powHash, mixDigest);
        if (logger.isDebugEnabled()) {
            logger.debug("eth_submitWork({}, {}, {}): {}", HexUtils.toUnformattedJsonHex(nonce), powHash, mixDigest, accepted);
        }
        return accepted;
    }

    @Override
    public boolean mining() {
        Boolean s = null;
        try {
            s = miningCoordinator.isMining();
            return s;
        } finally {
            logger.debug("eth_mining(): {}", s);
        }
    }

    @Override
    public String coinbase() {
        String s = null;
        try {
            s = miningCoordinator.getCoinbase().toJsonString();
            return s;
        } finally {
            logger.debug("eth_coinbase(): {}", s);
        }
    }
}
