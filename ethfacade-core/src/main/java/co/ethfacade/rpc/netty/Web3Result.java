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

package co.ethfacade.rpc.netty;

import io.netty.buffer.ByteBuf;

/**
 * A serialized JSON-RPC response on its way to the HTTP response handler, with the HTTP status to send.
 */
public class Web3Result {

    private final ByteBuf content;
    private final int code;

    public Web3Result(ByteBuf content, int code) {
        this.content = content;
        this.code = code;
    }

    public ByteBuf getContent() {
        return content;
    }

    public int getCode() {
        return code;
    }
}
