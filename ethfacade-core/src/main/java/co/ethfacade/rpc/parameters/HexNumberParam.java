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
import co.ethfacade.util.HexUtils;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.io.Serializable;
import java.math.BigInteger;

@JsonDeserialize(using = HexNumberParam.Deserializer.class)
public class HexNumberParam implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int HEX_NUM_BYTE_LENGTH = 32;
    public static final int MAX_HEX_NUM_LEN = 2 + 2 * HEX_NUM_BYTE_LENGTH; // 2 bytes for 0x prefix; 2 hex characters per byte

    private static final BigInteger MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);

    private final String hexNumber;

    public HexNumberParam(String hexNumber) {
        if (!HexUtils.isHexWithPrefix(hexNumber)) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid param: invalid hex string.");
        }

        if (!isHexNumberLengthValid(hexNumber)) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid param: invalid hex length.");
        }

        this.hexNumber = hexNumber;
    }

    public String getHexNumber() {
        return this.hexNumber;
    }

    public BigInteger toBigInteger() {
        return HexUtils.stringHexToBigInteger(hexNumber.toLowerCase());
    }

    /**
     * @throws co.ethfacade.rpc.exception.EthJsonRpcRequestException if the number doesn't fit in a signed long.
     */
    public long toLong() {
        BigInteger value = toBigInteger();
        if (value.compareTo(MAX_LONG) > 0) {
            throw EthJsonRpcRequestException.invalidParamError("Invalid param: number " + hexNumber + " is too big.");
        }
        return value.longValue();
    }

    @Override
    public String toString() {
        return this.hexNumber;
    }

    public static boolean isHexNumberLengthValid(String hex) {
        return hex != null && hex.length() <= MAX_HEX_NUM_LEN;
    }

    public static class Deserializer extends StdDeserializer<HexNumberParam> {

        private static final long serialVersionUID = 1L;

        public Deserializer() { this(null); }

        public Deserializer(Class<?> vc) { super(vc); }

        @Override
        public HexNumberParam deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException {
            String hexNumber = jp.getText();
            return new HexNumberParam(hexNumber);
        }
    }
}
