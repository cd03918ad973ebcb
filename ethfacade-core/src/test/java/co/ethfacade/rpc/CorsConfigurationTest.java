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

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CorsConfigurationTest {

    @Test
    void emptyOrMissingDomainsMeanNoCors() {
        assertFalse(new CorsConfiguration(null).hasOrigins());
        assertFalse(new CorsConfiguration("").hasOrigins());
        assertFalse(new CorsConfiguration(" , ").hasOrigins());
    }

    @Test
    void singleOrigin() {
        CorsConfiguration cors = new CorsConfiguration("https://wallet.example");

        assertTrue(cors.hasOrigins());
        assertFalse(cors.isAnyOrigin());
        assertEquals(Arrays.asList("https://wallet.example"), cors.getOrigins());
    }

    @Test
    void commaSeparatedOriginsAreTrimmed() {
        CorsConfiguration cors = new CorsConfiguration("https://wallet.example, http://localhost:3000 ,");

        assertEquals(Arrays.asList("https://wallet.example", "http://localhost:3000"), cors.getOrigins());
    }

    @Test
    void wildcardAllowsAnyOrigin() {
        CorsConfiguration cors = new CorsConfiguration("*");

        assertTrue(cors.hasOrigins());
        assertTrue(cors.isAnyOrigin());
    }

    @Test
    void wildcardCannotBeCombined() {
        assertThrows(IllegalArgumentException.class, () -> new CorsConfiguration("*, https://wallet.example"));
    }

    @Test
    void malformedOriginsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CorsConfiguration("wallet.example"));
        assertThrows(IllegalArgumentException.class, () -> new CorsConfiguration("https://wallet.example/path"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new CorsConfiguration("https://a.example\r\nX-Injected: 1"));
        assertTrue(e.getMessage().contains("Invalid CORS origin"));
    }
}
