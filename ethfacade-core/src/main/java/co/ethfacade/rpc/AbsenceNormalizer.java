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

package co.ethfacade.rpc;

import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.resourceNotFound;

/**
 * Turns a missing module result into what the method's {@link EthMethod.ResultShape} declares.
 */
public class AbsenceNormalizer {

    public Object normalize(EthMethod method, Object result) {
        if (result != null || method.getResultShape() == EthMethod.ResultShape.OPTIONAL) {
            return result;
        }

        throw resourceNotFound(String.format("%s: requested resource not found", method.getName()));
    }
}
