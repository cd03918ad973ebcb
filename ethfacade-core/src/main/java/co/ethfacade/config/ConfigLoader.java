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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Class that encapsulates config loading strategy.
 */
public class ConfigLoader {

    public static final String CONF_FILE_PROPERTY = "ethfacade.conf.file";

    private static final Logger logger = LoggerFactory.getLogger("config");

    private static final String YES = "yes";
    private static final String NO = "no";

    private final ConfigFactoryWrapper configFactory;

    public ConfigLoader() {
        this(ConfigFactoryWrapper.getInstance());
    }

    public ConfigLoader(ConfigFactoryWrapper configFactory) {
        this.configFactory = configFactory;
    }

    /**
     * Loads configurations from different sources with the following precedence:
     * 1. System properties
     * 2. User configuration file, given by -Dethfacade.conf.file
     * 3. Default settings in resources/reference.conf
     *
     * @throws FacadeConfigurationException if the user configuration file does not exist
     */
    public Config getConfig() {
        Config systemPropsConfig = configFactory.systemProperties();
        Config userCustomConfig = getUserCustomConfig();

        return configFactory.empty()
                .withFallback(systemPropsConfig)
                .withFallback(userCustomConfig)
                .withFallback(configFactory.defaultReference())
                .resolve();
    }

    private Config getUserCustomConfig() {
        String file = System.getProperty(CONF_FILE_PROPERTY);
        if (file == null) {
            logger.info("Config ( {} ): user properties from -D{} file", NO, CONF_FILE_PROPERTY);
            return configFactory.empty();
        }

        File configFile = new File(file);
        if (!configFile.isFile()) {
            throw new FacadeConfigurationException(String.format("Configuration file '%s' not found", file));
        }

        Config cmdLineConfigFile = configFactory.parseFile(configFile);
        logger.info(
                "Config ( {} ): user properties from -D{} file '{}'",
                cmdLineConfigFile.entrySet().isEmpty() ? NO : YES,
                CONF_FILE_PROPERTY,
                file
        );
        return cmdLineConfigFile;
    }
}
