package com.omega.hoa.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named acceptance schemes that may appear on an {@code acc-name:} line.
 */
public enum AcceptanceName {
    BUCHI("Buchi"),
    GENERALIZED_BUCHI("generalized-Buchi"),
    CO_BUCHI("co-Buchi"),
    GENERALIZED_CO_BUCHI("generalized-co-Buchi"),
    STREETT("Streett"),
    RABIN("Rabin"),
    GENERALIZED_RABIN("generalized-Rabin"),
    PARITY("parity"),
    ALL("all"),
    NONE("none");

    private final String hoaName;

    AcceptanceName(String hoaName) {
        this.hoaName = hoaName;
    }

    public String getHoaName() {
        return hoaName;
    }

    public static Optional<AcceptanceName> fromHoa(String name) {
        return Arrays.stream(values())
                .filter(n -> n.hoaName.equals(name))
                .findFirst();
    }
}
