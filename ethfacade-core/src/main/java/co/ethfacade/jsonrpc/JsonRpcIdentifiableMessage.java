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

package co.ethfacade.jsonrpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * The basic JSON-RPC response. The id is echoed exactly as the client sent it, which can be
 * a number, a string or null when the request id couldn't be read.
 */
public abstract class JsonRpcIdentifiableMessage extends JsonRpcMessage {
    private final JsonNode id;

    protected JsonRpcIdentifiableMessage(JsonRpcVersion version, JsonNode id) {
        super(version);
        this.id = id == null ? NullNode.getInstance() : id;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public JsonNode getId() {
        return id;
    }
}
