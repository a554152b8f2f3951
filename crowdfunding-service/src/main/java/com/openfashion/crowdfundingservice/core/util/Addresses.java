package com.openfashion.crowdfundingservice.core.util;

import com.openfashion.crowdfundingservice.core.exceptions.InvalidInputException;

import java.util.Locale;
import java.util.regex.Pattern;

public class Addresses {

    private Addresses(){}

    public static final String PATTERN = "^0x[0-9a-fA-F]{40}$";

    private static final Pattern ADDRESS = Pattern.compile(PATTERN);

    public static String normalize(String field, String address) {
        if (address == null || !ADDRESS.matcher(address.trim()).matches()) {
            throw new InvalidInputException(field, address, "not a 20-byte hex address");
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
