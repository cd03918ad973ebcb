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

package co.ethfacade.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Instance wrapper over {@link ConfigFactory} statics, so config sources can be replaced in tests.
 */
public class ConfigFactoryWrapper {

    private static final ConfigFactoryWrapper instance = new ConfigFactoryWrapper();

    public static ConfigFactoryWrapper getInstance() {
        return instance;
    }

    public Config systemProperties() {
        return ConfigFactory.systemProperties();
    }

    public Config empty() {
        return ConfigFactory.empty();
    }

    public Config parseFile(File file) {
        return ConfigFactory.parseFile(file);
    }

    public Config defaultReference() {
        return ConfigFactory.defaultReference();
    }
}
