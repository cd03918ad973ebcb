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

package co.ethfacade.backend;

import co.ethfacade.core.Keccak256;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Result of submitting a transaction to the pool.
 */
@Immutable
public final class PoolAdmission {

    public enum Status {
        ACCEPTED,
        ALREADY_KNOWN,
        INVALID,
        REJECTED
    }

    private final Status status;
    @Nullable
    private final Keccak256 hash;
    @Nullable
    private final String reason;

    private PoolAdmission(Status status, @Nullable Keccak256 hash, @Nullable String reason) {
        this.status = status;
        this.hash = hash;
        this.reason = reason;
    }

    public static PoolAdmission accepted(Keccak256 hash) {
        return new PoolAdmission(Status.ACCEPTED, hash, null);
    }

    public static PoolAdmission alreadyKnown(Keccak256 hash) {
        return new PoolAdmission(Status.ALREADY_KNOWN, hash, null);
    }

    /**
     * The transaction could not be decoded or its signature is wrong.
     */
    public static PoolAdmission invalid(String reason) {
        return new PoolAdmission(Status.INVALID, null, reason);
    }

    public static PoolAdmission rejected(String reason) {
        return new PoolAdmission(Status.REJECTED, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAdmitted() {
        return status == Status.ACCEPTED || status == Status.ALREADY_KNOWN;
    }

    @Nullable
    public Keccak256 getHash() {
        return hash;
    }

    @Nullable
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "PoolAdmission{status=" + status + ", hash=" + hash + ", reason=" + reason + '}';
    }
}
