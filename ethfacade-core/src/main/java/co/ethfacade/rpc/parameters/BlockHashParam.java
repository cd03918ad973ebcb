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

package co.ethfacade.rpc.parameters;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@JsonDeserialize(using = BlockHashParam.Deserializer.class)
public class BlockHashParam extends HashParam32 {
    private static final String HASH_TYPE = "block hash";

    public BlockHashParam(String hash) {
        super(HASH_TYPE, hash);
    }

    public static class Deserializer extends HashDeserializer<BlockHashParam> {

        private static final long serialVersionUID = 8400129542290437462L;

        public Deserializer() {
            super(BlockHashParam.class, HASH_TYPE);
        }

        @Override
        protected BlockHashParam create(String hash) {
            return new BlockHashParam(hash);
        }
    }
}
