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

import co.ethfacade.core.Keccak256;
import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import co.ethfacade.util.HexUtils;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * A 32-byte hash argument. Subclasses only name the kind of hash, used in validation messages.
 */
public abstract class HashParam32 {
    public static final int HASH_BYTE_LENGTH = Keccak256.HASH_LEN;
    public static final int HASH_HEX_LEN = 2 + 2 * HASH_BYTE_LENGTH; // 2 bytes for 0x prefix; 2 hex characters per byte

    private final Keccak256 hash;

    HashParam32(String hashType, String hash) {
        if (hash == null || hash.length() != HASH_HEX_LEN) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid " + hashType + ": incorrect length.");
        }

        if (!HexUtils.isHexWithPrefix(hash)) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid " + hashType + " format: invalid hex value");
        }

        byte[] hashBytes;

        try {
            hashBytes = HexUtils.stringHexToByteArray(hash);
        } catch (Exception e) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid " + hashType + " format: invalid hex value", e);
        }

        this.hash = new Keccak256(hashBytes);
    }

    public Keccak256 getHash() {
        return hash;
    }

    /**
     * Reads a hash from a JSON string. Numbers, booleans and structured values are rejected
     * instead of being coerced to text.
     */
    abstract static class HashDeserializer<T extends HashParam32> extends StdDeserializer<T> {

        private static final long serialVersionUID = -6290521389465173725L;

        private final String hashType;

        HashDeserializer(Class<T> type, String hashType) {
            super(type);
            this.hashType = hashType;
        }

        protected abstract T create(String hash);

        @Override
        public T deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException {
            if (jp.currentToken() != JsonToken.VALUE_STRING) {
                throw EthJsonRpcRequestException.invalidParamError("Invalid " + hashType + ": expected a hex string");
            }
            return create(jp.getText());
        }
    }
}
