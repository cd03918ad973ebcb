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

package co.ethfacade.rpc;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Dispatch settings for the eth module: methods switched off by configuration and call timeouts.
 */
public class EthModuleDescription {
    private final Set<String> disabledMethods;
    private final long timeout;
    private final Map<String, Long> methodTimeoutMap;

    public EthModuleDescription(Set<String> disabledMethods, long timeout, Map<String, Long> methodTimeoutMap) {
        this.disabledMethods = disabledMethods == null ? Collections.emptySet() : new HashSet<>(disabledMethods);
        this.timeout = timeout;
        this.methodTimeoutMap = methodTimeoutMap == null ? Collections.emptyMap() : new HashMap<>(methodTimeoutMap);
    }

    public static EthModuleDescription allEnabled(long timeout) {
        return new EthModuleDescription(Collections.emptySet(), timeout, Collections.emptyMap());
    }

    public boolean methodIsEnabled(String methodName) {
        return !disabledMethods.contains(methodName);
    }

    /**
     * @return the timeout in milliseconds for the given method, 0 for none.
     */
    public long getTimeout(String methodName) {
        return methodTimeoutMap.getOrDefault(methodName, timeout);
    }

    public Set<String> getDisabledMethods() {
        return Collections.unmodifiableSet(disabledMethods);
    }
}
