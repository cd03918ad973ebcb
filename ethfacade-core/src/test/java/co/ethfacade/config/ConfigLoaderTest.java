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

package co.ethfacade.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConfigLoaderTest {

    private ConfigFactoryWrapper configFactory;
    private ConfigLoader loader;

    @BeforeEach
    void setUp() {
        System.clearProperty(ConfigLoader.CONF_FILE_PROPERTY);
        configFactory = mock(ConfigFactoryWrapper.class);
        when(configFactory.empty()).thenReturn(ConfigFactory.empty());
        when(configFactory.systemProperties()).thenReturn(ConfigFactory.empty());
        when(configFactory.defaultReference()).thenReturn(ConfigFactory.parseString("rpc.timeout = 0\nrpc.workers = 2"));
        loader = new ConfigLoader(configFactory);
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(ConfigLoader.CONF_FILE_PROPERTY);
    }

    @Test
    void referenceDefaultsApplyWithoutOverrides() {
        Config config = loader.getConfig();

        assertEquals(2, config.getInt("rpc.workers"));
        verify(configFactory, never()).parseFile(any());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        when(configFactory.systemProperties()).thenReturn(ConfigFactory.parseString("rpc.workers = 8"));

        Config config = loader.getConfig();

        assertEquals(8, config.getInt("rpc.workers"));
        assertEquals(0, config.getInt("rpc.timeout"));
    }

    @Test
    void missingUserFileFailsLoading() {
        System.setProperty(ConfigLoader.CONF_FILE_PROPERTY, "/nonexistent/ethfacade.conf");

        FacadeConfigurationException e = assertThrows(FacadeConfigurationException.class, loader::getConfig);
        assertTrue(e.getMessage().contains("/nonexistent/ethfacade.conf"));
    }
}
