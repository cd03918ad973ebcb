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

import javax.annotation.concurrent.Immutable;
import java.util.Arrays;

/**
 * A 32 bytes word, as used by storage keys, storage values and log topics.
 * Shorter inputs are left padded with zeroes.
 */
@Immutable
public final class DataWord {

    public static final int BYTES = 32;

    public static final DataWord ZERO = new DataWord(new byte[BYTES]);

    private final byte[] data;

    private DataWord(byte[] data) {
        this.data = data;
    }

    public static DataWord valueOf(byte[] data) {
        if (data == null || data.length == 0) {
            return ZERO;
        }

        if (data.length > BYTES) {
            throw new IllegalArgumentException(String.format("A data word can't be longer than %d bytes", BYTES));
        }

        return new DataWord(ByteUtil.leftPadBytes(ByteUtil.cloneBytes(data), BYTES));
    }

    public static DataWord valueFromHex(String hex) {
        return valueOf(HexUtils.stringHexToByteArray(hex));
    }

    /**
     * @return a copy of the 32 bytes.
     */
    public byte[] getData() {
        return Arrays.copyOf(data, data.length);
    }

    public boolean isZero() {
        return ByteUtil.isAllZeroes(data);
    }

    public String toJsonString() {
        return HexUtils.toUnformattedJsonHex(data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        return Arrays.equals(data, ((DataWord) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return ByteUtil.toHexString(data);
    }
}
