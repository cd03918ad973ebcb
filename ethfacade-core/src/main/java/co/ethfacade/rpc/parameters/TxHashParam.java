/*
 * This file is part of EthFacade
 * Copyright (C) 2023 RSK Labs Ltd.
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

@JsonDeserialize(using = TxHashParam.Deserializer.class)
public class TxHashParam extends HashParam32 {
    private static final String HASH_TYPE = "transaction hash";

    public TxHashParam(String hash) {
        super(HASH_TYPE, hash);
    }

    public static class Deserializer extends HashDeserializer<TxHashParam> {

        private static final long serialVersionUID = 2669501504172497269L;

        public Deserializer() {
            super(TxHashParam.class, HASH_TYPE);
        }

        @Override
        protected TxHashParam create(String hash) {
            return new TxHashParam(hash);
        }
    }
}
