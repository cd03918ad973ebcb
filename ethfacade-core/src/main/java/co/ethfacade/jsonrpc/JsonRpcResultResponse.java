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

package co.ethfacade.jsonrpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * This the JSON-RPC success response DTO for JSON serialization purposes.
 * A null result is serialized as an explicit JSON null.
 */
public class JsonRpcResultResponse extends JsonRpcIdentifiableMessage {
    private final Object result;

    public JsonRpcResultResponse(JsonNode id, Object result) {
        super(JsonRpcVersion.V2_0, id);
        this.result = result;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Object getResult() {
        return result;
    }
}
