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

package co.ethfacade.rpc;

import co.ethfacade.core.Keccak256;
import co.ethfacade.util.HexUtils;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;

import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.invalidParamError;

/**
 * A client block identifier: an exact height, a block hash or one of the
 * "earliest", "latest" and "pending" tags.
 *
 * Heights are unsigned 64 bits values.
 */
@Immutable
public final class BlockRef {

    public static final String EARLIEST = "earliest";
    public static final String LATEST = "latest";
    public static final String PENDING = "pending";

    private static final int MAX_QUANTITY_DIGITS = 16;

    public enum Kind {
        NUMBER,
        HASH,
        EARLIEST,
        LATEST,
        PENDING
    }

    private static final BlockRef EARLIEST_REF = new BlockRef(Kind.EARLIEST, 0, null);
    private static final BlockRef LATEST_REF = new BlockRef(Kind.LATEST, 0, null);
    private static final BlockRef PENDING_REF = new BlockRef(Kind.PENDING, 0, null);

    private final Kind kind;
    private final long number;
    @Nullable
    private final Keccak256 hash;

    private BlockRef(Kind kind, long number, @Nullable Keccak256 hash) {
        this.kind = kind;
        this.number = number;
        this.hash = hash;
    }

    public static BlockRef earliest() {
        return EARLIEST_REF;
    }

    public static BlockRef latest() {
        return LATEST_REF;
    }

    public static BlockRef pending() {
        return PENDING_REF;
    }

    public static BlockRef number(long number) {
        return new BlockRef(Kind.NUMBER, number, null);
    }

    public static BlockRef hash(Keccak256 hash) {
        return new BlockRef(Kind.HASH, 0, Objects.requireNonNull(hash));
    }

    /**
     * Parses a block tag or a hex quantity.
     *
     * @throws co.ethfacade.rpc.exception.EthJsonRpcRequestException if the identifier is neither.
     */
    public static BlockRef fromIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw invalidParamError("Invalid block identifier: empty or null.");
        }

        switch (identifier) {
            case EARLIEST:
                return earliest();
            case LATEST:
                return latest();
            case PENDING:
                return pending();
            default:
                return number(parseQuantity(identifier));
        }
    }

    private static long parseQuantity(String identifier) {
        if (!HexUtils.isHexWithPrefix(identifier)) {
            throw invalidParamError("Invalid block identifier '" + identifier + "'");
        }

        String digits = HexUtils.removeHexPrefix(identifier.toLowerCase()).replaceFirst("^0+(?=.)", "");
        if (digits.length() > MAX_QUANTITY_DIGITS) {
            throw invalidParamError("Invalid block identifier '" + identifier + "': number exceeds 64 bits");
        }

        return Long.parseUnsignedLong(digits, 16);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the unsigned height, only meaningful for {@link Kind#NUMBER}.
     */
    public long getNumber() {
        return number;
    }

    @Nullable
    public Keccak256 getHash() {
        return hash;
    }

    public boolean isPending() {
        return kind == Kind.PENDING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        BlockRef other = (BlockRef) o;
        return kind == other.kind && number == other.number && Objects.equals(hash, other.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, hash);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return HexUtils.toQuantityJsonHex(number);
            case HASH:
                return hash.toJsonString();
            default:
                return kind.name().toLowerCase();
        }
    }
}
