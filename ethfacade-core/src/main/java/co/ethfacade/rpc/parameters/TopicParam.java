/*
 * This file is part of EthFacade
 * Copyright (C) 2023 RSK Labs Ltd.
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

import co.ethfacade.core.DataWord;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@JsonDeserialize(using = TopicParam.Deserializer.class)
public class TopicParam extends HashParam32 {
    private static final String HASH_TYPE = "topic";

    public TopicParam(String topic) {
        super(HASH_TYPE, topic);
    }

    public DataWord toDataWord() {
        return DataWord.valueOf(getHash().getBytes());
    }

    public static class Deserializer extends HashDeserializer<TopicParam> {

        private static final long serialVersionUID = -1434823456729014875L;

        public Deserializer() {
            super(TopicParam.class, HASH_TYPE);
        }

        @Override
        protected TopicParam create(String topic) {
            return new TopicParam(topic);
        }
    }
}
