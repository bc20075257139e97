package com.omega.hoa.symbolic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.sf.javabdd.BDD;
import net.sf.javabdd.BDDFactory;
import net.sf.javabdd.JFactory;

/**
 * Decision-diagram table over acceptance atoms. Set {@code i} owns two variables:
 * {@code 2i} stands for {@code Inf(i)} and {@code 2i+1} for {@code Inf(!i)}.
 * {@code Fin(x)} is encoded as the negation of {@code Inf(x)}.
 */
public class AcceptanceSpace {
    private static final Logger log = LoggerFactory.getLogger(AcceptanceSpace.class);

    private final BDDFactory factory;

    public AcceptanceSpace(int nodeTableSize, int cacheSize) {
        this.factory = JFactory.init(nodeTableSize, cacheSize);
    }

    public synchronized void ensureSets(int setCount) {
        int needed = 2 * setCount;
        if (needed > factory.varNum()) {
            log.debug("Growing acceptance space from {} to {} variables", factory.varNum(), needed);
            factory.setVarNum(needed);
        }
    }

    static int infVariable(int set, boolean complemented) {
        return 2 * set + (complemented ? 1 : 0);
    }

    static boolean isComplementVariable(int variable) {
        return (variable & 1) == 1;
    }

    static int setOf(int variable) {
        return variable >> 1;
    }

    /** Caller holds the monitor. */
    BDD inf(int set, boolean complemented) {
        ensureSets(set + 1);
        return factory.ithVar(infVariable(set, complemented));
    }

    /** Caller holds the monitor. */
    BDD fin(int set, boolean complemented) {
        ensureSets(set + 1);
        return factory.nithVar(infVariable(set, complemented));
    }

    BDDFactory factory() {
        return factory;
    }
}
