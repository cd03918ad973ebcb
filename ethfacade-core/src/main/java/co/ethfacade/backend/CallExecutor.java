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

import co.ethfacade.core.BlockHeader;
import co.ethfacade.core.CallRequest;

public interface CallExecutor {

    /**
     * Executes the call on top of the given state. Nothing the execution writes is kept.
     *
     * @param gasLimit the gas available to the execution
     */
    ExecutionResult execute(CallRequest call, BlockHeader block, AccountStateSnapshot state, long gasLimit)
            throws SandboxExecutionException;
}
