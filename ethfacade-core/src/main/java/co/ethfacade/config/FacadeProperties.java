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

import co.ethfacade.rpc.EthMethod;
import co.ethfacade.rpc.EthModuleDescription;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Typed access to the facade configuration. Every key has a default in reference.conf.
 */
public class FacadeProperties {

    private static final Logger logger = LoggerFactory.getLogger("config");

    public static final String PROPERTY_RPC_HTTP_ENABLED = "rpc.providers.web.http.enabled";
    public static final String PROPERTY_RPC_HTTP_BIND_ADDRESS = "rpc.providers.web.http.bind_address";
    public static final String PROPERTY_RPC_HTTP_PORT = "rpc.providers.web.http.port";
    public static final String PROPERTY_RPC_HTTP_LINGER_TIME = "rpc.providers.web.http.linger_time";
    public static final String PROPERTY_RPC_HTTP_REUSE_ADDRESS = "rpc.providers.web.http.reuse_address";
    public static final String PROPERTY_RPC_HTTP_CORS = "rpc.providers.web.http.cors_domain";
    public static final String PROPERTY_RPC_HTTP_MAX_FRAME_SIZE = "rpc.providers.web.http.max_aggregated_frame_size";
    public static final String PROPERTY_RPC_WORKERS = "rpc.workers";
    public static final String PROPERTY_RPC_TIMEOUT = "rpc.timeout";
    public static final String PROPERTY_RPC_METHOD_TIMEOUT = "rpc.methodTimeout";
    public static final String PROPERTY_RPC_MAX_BATCH_REQUESTS_SIZE = "rpc.maxBatchRequestsSize";
    public static final String PROPERTY_RPC_DISABLED_METHODS = "rpc.disabledMethods";
    public static final String PROPERTY_ESTIMATE_GAS_REVERT_POLICY = "rpc.eth.estimateGas.revertPolicy";
    public static final String PROPERTY_ESTIMATE_GAS_CAP = "rpc.eth.estimateGas.cap";

    private final Config configFromFiles;

    public FacadeProperties(ConfigLoader loader) {
        this(loader.getConfig());
    }

    public FacadeProperties(Config config) {
        this.configFromFiles = config;
    }

    public boolean isRpcHttpEnabled() {
        return configFromFiles.getBoolean(PROPERTY_RPC_HTTP_ENABLED);
    }

    public InetAddress rpcHttpBindAddress() {
        String host = configFromFiles.getString(PROPERTY_RPC_HTTP_BIND_ADDRESS);
        try {
            return InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            throw new FacadeConfigurationException(String.format("%s: unable to resolve '%s'", PROPERTY_RPC_HTTP_BIND_ADDRESS, host), e);
        }
    }

    public int rpcHttpPort() {
        return configFromFiles.getInt(PROPERTY_RPC_HTTP_PORT);
    }

    public int soLingerTime() {
        return configFromFiles.getInt(PROPERTY_RPC_HTTP_LINGER_TIME);
    }

    public boolean rpcHttpReuseAddress() {
        return configFromFiles.getBoolean(PROPERTY_RPC_HTTP_REUSE_ADDRESS);
    }

    public String corsDomains() {
        return configFromFiles.getString(PROPERTY_RPC_HTTP_CORS);
    }

    public int rpcHttpMaxAggregatedFrameSize() {
        return configFromFiles.getInt(PROPERTY_RPC_HTTP_MAX_FRAME_SIZE);
    }

    public int rpcWorkers() {
        int workers = configFromFiles.getInt(PROPERTY_RPC_WORKERS);
        if (workers <= 0) {
            return Runtime.getRuntime().availableProcessors();
        }
        return workers;
    }

    /**
     * @return the call timeout in milliseconds, 0 for none.
     */
    public long rpcTimeout() {
        return configFromFiles.getDuration(PROPERTY_RPC_TIMEOUT).toMillis();
    }

    public Map<String, Long> rpcMethodTimeouts() {
        Map<String, Long> timeouts = new HashMap<>();
        if (!configFromFiles.hasPath(PROPERTY_RPC_METHOD_TIMEOUT)) {
            return timeouts;
        }

        Config methodTimeouts = configFromFiles.getConfig(PROPERTY_RPC_METHOD_TIMEOUT);
        for (Map.Entry<String, ConfigValue> entry : methodTimeouts.root().entrySet()) {
            String method = entry.getKey();
            warnIfUnknownMethod(PROPERTY_RPC_METHOD_TIMEOUT, method);
            timeouts.put(method, methodTimeouts.getDuration(quote(method)).toMillis());
        }
        return timeouts;
    }

    public int rpcMaxBatchRequestsSize() {
        int size = configFromFiles.getInt(PROPERTY_RPC_MAX_BATCH_REQUESTS_SIZE);
        if (size <= 0) {
            throw new FacadeConfigurationException(String.format("%s must be positive, got %d", PROPERTY_RPC_MAX_BATCH_REQUESTS_SIZE, size));
        }
        return size;
    }

    public Set<String> rpcDisabledMethods() {
        Set<String> disabled = new LinkedHashSet<>(configFromFiles.getStringList(PROPERTY_RPC_DISABLED_METHODS));
        disabled.forEach(m -> warnIfUnknownMethod(PROPERTY_RPC_DISABLED_METHODS, m));
        return disabled;
    }

    public EstimateGasRevertPolicy estimateGasRevertPolicy() {
        return EstimateGasRevertPolicy.fromConfigValue(configFromFiles.getString(PROPERTY_ESTIMATE_GAS_REVERT_POLICY));
    }

    /**
     * @return the gas cap of eth_estimateGas when the request carries no gas, 0 to use the block gas limit.
     */
    public long estimateGasCap() {
        return configFromFiles.getLong(PROPERTY_ESTIMATE_GAS_CAP);
    }

    public EthModuleDescription ethModuleDescription() {
        return new EthModuleDescription(rpcDisabledMethods(), rpcTimeout(), rpcMethodTimeouts());
    }

    private static void warnIfUnknownMethod(String property, String method) {
        if (!EthMethod.fromName(method).isPresent()) {
            logger.warn("{} lists unknown method '{}'", property, method);
        }
    }

    private static String quote(String key) {
        return "\"" + key + "\"";
    }
}
