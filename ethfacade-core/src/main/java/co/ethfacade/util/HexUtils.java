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

package co.ethfacade.util;

import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.regex.Pattern;

import static co.ethfacade.rpc.exception.EthJsonRpcRequestException.invalidParamError;

/**
 * Hex utils
 */
public class HexUtils {

    private static final Pattern LEADING_ZEROS_PATTERN = Pattern.compile("0x(0)+");

    public static final String HEX_PREFIX = "0x";

    private static final String ZERO_STR = "0";

    private static final String INCORRECT_HEX_SYNTAX = "Incorrect hex syntax";
    private static final String PREFIX_EXPECTED = "Invalid hex number, expected 0x prefix";

    private HexUtils() {
        throw new IllegalAccessError("Utility class");
    }

    /**
     * Convert hex encoded string to decoded BigInteger
     */
    public static BigInteger stringHexToBigInteger(final String input) {
        if (!hasHexPrefix(input)) {
            throw new NumberFormatException(PREFIX_EXPECTED);
        }
        String hexa = input.substring(2);
        return new BigInteger(hexa, 16);
    }

    /**
     * Convert hex encoded string to decoded byte array
     */
    public static byte[] stringHexToByteArray(final String param) {
        String result = removeHexPrefix(param);

        if (result.length() % 2 != 0) { //NOSONAR
            result = ZERO_STR + result;
        }
        return Hex.decode(result);
    }

    /**
     * Converts a byte array to a string according to ethereum json-rpc specifications
     */
    public static String toJsonHex(final byte[] param) {
        String result = toUnformattedJsonHex(param);

        if (HEX_PREFIX.equals(result)) {
            return "0x00";
        }

        return result;
    }

    /**
     * @return A Hex representation of n WITHOUT leading zeroes
     */
    public static String toQuantityJsonHex(long n) {
        return HEX_PREFIX + Long.toHexString(n);
    }

    /**
     * @return A Hex representation of n WITHOUT leading zeroes
     */
    public static String toQuantityJsonHex(BigInteger n) {
        return HEX_PREFIX + n.toString(16);
    }

    /**
     * Converts a byte array to a string according to ethereum json-rpc specifications, null and empty
     * convert to 0x.
     *
     * @param param An unformatted byte array
     * @return A hex representation of the input with two hex digits per byte
     */
    public static String toUnformattedJsonHex(byte[] param) {
        return HEX_PREFIX + (param == null ? "" : ByteUtil.toHexString(param));
    }

    /**
     * Converts a byte array representing a quantity according to ethereum json-rpc specifications.
     *
     * <p>
     * 0x000AEF -> 0x2AEF
     * <p>
     * 0x00 -> 0x0
     * @param x A byte array with or without leading zeroes. If null, it is considered as zero.
     * @return A hex string without leading zeroes ("0xAEF")
     */
    public static String toQuantityJsonHex(byte[] x) {
        String withoutLeading = LEADING_ZEROS_PATTERN.matcher(toJsonHex(x)).replaceFirst(HEX_PREFIX);
        if (HEX_PREFIX.equals(withoutLeading)) {
            return "0x0";
        }

        return withoutLeading;
    }

    /**
     * decodes a hexadecimal encoded with the 0x prefix into a long
     */
    public static long jsonHexToLong(String x) {
        if (!hasHexPrefix(x)) {
            throw new NumberFormatException(INCORRECT_HEX_SYNTAX);
        }
        return Long.parseUnsignedLong(removeHexPrefix(x), 16);
    }

    /**
     * decodes a hexadecimal encoded with the 0x prefix into a integer
     */
    public static int jsonHexToInt(final String param) {
        if (!hasHexPrefix(param)) {
            throw invalidParamError(INCORRECT_HEX_SYNTAX);
        }

        return Integer.parseInt(removeHexPrefix(param), 16);
    }

    /**
     * if the parameter has the hex prefix
     */
    public static boolean hasHexPrefix(final String data) {
        return data != null && data.startsWith(HEX_PREFIX);
    }

    /**
     * if string is hexadecimal with 0x prefix
     */
    public static boolean isHexWithPrefix(final String data) {
        if (data == null) {
            return false;
        }

        String value = data.toLowerCase();

        if (value.length() <= 2 || !hasHexPrefix(value)) {
            return false;
        }

        return isHex(value, 2);
    }

    /**
     * if a string is composed solely of lower case hexa chars starting at the given index
     */
    public static boolean isHex(final String data, int startAt) {
        if (data == null) {
            return false;
        }

        for (int i = startAt; i < data.length(); i++) {
            char c = data.charAt(i);

            if (!(c >= '0' && c <= '9' || c >= 'a' && c <= 'f')) {
                return false;
            }
        }

        return true;
    }

    /**
     * remove Hex Prefix from string
     */
    public static String removeHexPrefix(final String data) {
        String result = data;
        if (hasHexPrefix(result)) {
            result = data.substring(2);
        }
        return result;
    }
}
