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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Origins allowed by the HTTP transport, parsed from a comma separated list.
 * An empty list disables CORS and {@code *} allows any origin.
 */
public class CorsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger("cors");

    private static final String ANY_ORIGIN = "*";
    private static final Pattern ORIGIN = Pattern.compile("[a-zA-Z][a-zA-Z0-9+.-]*://[^\\s/?#,]+");

    private final List<String> origins;

    public CorsConfiguration(String domains) {
        this.origins = parseOrigins(domains);

        if (isAnyOrigin()) {
            logger.warn("CORS header set to '*'");
        }
    }

    public List<String> getOrigins() {
        return origins;
    }

    public boolean hasOrigins() {
        return !origins.isEmpty();
    }

    public boolean isAnyOrigin() {
        return origins.size() == 1 && ANY_ORIGIN.equals(origins.get(0));
    }

    private static List<String> parseOrigins(String domains) {
        if (domains == null || domains.trim().isEmpty()) {
            return Collections.emptyList();
        }

        List<String> result = new ArrayList<>();
        for (String part : domains.split(",", -1)) {
            String origin = part.trim();
            if (origin.isEmpty()) {
                continue;
            }

            if (!ANY_ORIGIN.equals(origin) && !ORIGIN.matcher(origin).matches()) {
                throw new IllegalArgumentException(String.format("Invalid CORS origin '%s'", origin));
            }
            result.add(origin);
        }

        if (result.size() > 1 && result.contains(ANY_ORIGIN)) {
            throw new IllegalArgumentException("CORS origin '*' cannot be combined with other origins");
        }

        return Collections.unmodifiableList(result);
    }
}
