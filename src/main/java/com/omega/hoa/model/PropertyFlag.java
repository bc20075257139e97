package com.omega.hoa.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Structural properties an automaton may declare on its {@code properties:} lines.
 */
public enum PropertyFlag {
    STATE_LABELS("state-labels"),
    TRANS_LABELS("trans-labels"),
    IMPLICIT_LABELS("implicit-labels"),
    EXPLICIT_LABELS("explicit-labels"),
    STATE_ACC("state-acc"),
    TRANS_ACC("trans-acc"),
    UNIV_BRANCH("univ-branch"),
    NO_UNIV_BRANCH("no-univ-branch"),
    DETERMINISTIC("deterministic"),
    COMPLETE("complete"),
    UNAMBIGUOUS("unambiguous"),
    STUTTER_INVARIANT("stutter-invariant"),
    WEAK("weak"),
    VERY_WEAK("very-weak"),
    INHERENTLY_WEAK("inherently-weak"),
    TERMINAL("terminal"),
    TIGHT("tight"),
    COLORED("colored");

    private final String hoaName;

    PropertyFlag(String hoaName) {
        this.hoaName = hoaName;
    }

    public String getHoaName() {
        return hoaName;
    }

    public static Optional<PropertyFlag> fromHoa(String name) {
        return Arrays.stream(values())
                .filter(flag -> flag.hoaName.equals(name))
                .findFirst();
    }
}
