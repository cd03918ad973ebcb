/*
 * This file is part of EthFacade
 * Copyright (C) 2018 RSK Labs Ltd.
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

import co.ethfacade.rpc.exception.EthJsonRpcRequestException;
import co.ethfacade.util.ByteUtil;
import co.ethfacade.util.HexUtils;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.io.Serializable;

/**
 * The 8 bytes proof of work nonce.
 */
@JsonDeserialize(using = HexNonceParam.Deserializer.class)
public class HexNonceParam extends HexStringParam implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int NONCE_BYTE_LENGTH = 8;
    private static final int NONCE_HEX_LEN = 2 + 2 * NONCE_BYTE_LENGTH;

    private final byte[] nonce;

    public HexNonceParam(String nonce) {
        super(nonce);

        if (nonce.length() != NONCE_HEX_LEN) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid nonce: incorrect length.");
        }

        this.nonce = HexUtils.stringHexToByteArray(nonce);
    }

    public byte[] getNonce() {
        return ByteUtil.cloneBytes(nonce);
    }

    public static class Deserializer extends StdDeserializer<HexNonceParam> {
        private static final long serialVersionUID = 1L;

        public Deserializer() { this(null); }

        public Deserializer(Class<?> vc) { super(vc); }

        @Override
        public HexNonceParam deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException {
            return new HexNonceParam(jp.getText());
        }
    }
}
