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

package co.ethfacade.core;

import co.ethfacade.util.ByteUtil;
import co.ethfacade.util.HexUtils;
import com.google.common.primitives.Ints;

import java.io.Serializable;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A Keccak256 just wraps a byte[] so that equals and hashcode work correctly, allowing it to be used as keys in a
 * map. It also checks that the length is correct and provides a bit more type safety.
 */
public class Keccak256 implements Serializable {
    public static final int HASH_LEN = 32;
    public static final Keccak256 ZERO_HASH = new Keccak256(new byte[HASH_LEN]);
    private static final long serialVersionUID = -3076062998897837430L;

    private final byte[] bytes;

    public Keccak256(byte[] rawHashBytes) {
        checkArgument(rawHashBytes.length == HASH_LEN);
        this.bytes = rawHashBytes;
    }

    public Keccak256(String hexString) {
        this(HexUtils.stringHexToByteArray(hexString));
    }

    public String toJsonString() {
        return HexUtils.toUnformattedJsonHex(this.bytes);
    }

    public String toHexString() {
        return ByteUtil.toHexString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o != null && getClass() == o.getClass() && Arrays.equals(bytes, ((Keccak256) o).bytes);
    }

    /**
     * Returns the last four bytes of the wrapped hash. Proof of work hashes tend to start with zeros.
     */
    @Override
    public int hashCode() {
        return Ints.fromBytes(bytes[28], bytes[29], bytes[30], bytes[31]);
    }

    /**
     * @return a DEBUG representation of the hash, mainly used for logging.
     */
    @Override
    public String toString() {
        return toHexString();
    }

    /**
     * Returns the internal byte array, without defensively copying. Therefore do NOT modify the returned array.
     */
    public byte[] getBytes() {
        return bytes;
    }
}
