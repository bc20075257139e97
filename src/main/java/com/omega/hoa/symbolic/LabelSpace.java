package com.omega.hoa.symbolic;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.sf.javabdd.BDD;
import net.sf.javabdd.BDDFactory;
import net.sf.javabdd.JFactory;

/**
 * Decision-diagram table over atomic propositions; variable {@code i} is proposition {@code i}.
 *
 * All operations on the table and on {@link Guard}s created from it are serialized on this
 * object, so one space may be shared by readers running on different threads.
 */
public class LabelSpace {
    private static final Logger log = LoggerFactory.getLogger(LabelSpace.class);

    /** Full enumerations of 2^n rows are refused beyond this. */
    public static final int MAX_ENUMERABLE_PROPOSITIONS = 30;

    private final BDDFactory factory;
    private final Guard top;
    private final Guard bottom;

    public LabelSpace(int nodeTableSize, int cacheSize) {
        this.factory = JFactory.init(nodeTableSize, cacheSize);
        this.top = new Guard(this, factory.one());
        this.bottom = new Guard(this, factory.zero());
    }

    public Guard top() {
        return top;
    }

    public Guard bottom() {
        return bottom;
    }

    public synchronized int variableCount() {
        return factory.varNum();
    }

    /**
     * Grows the variable set to at least {@code count} propositions.
     */
    public synchronized void ensureVariables(int count) {
        if (count > factory.varNum()) {
            log.debug("Growing label space from {} to {} variables", factory.varNum(), count);
            factory.setVarNum(count);
        }
    }

    public synchronized Guard proposition(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Proposition index must be >= 0. Got: " + index);
        }
        ensureVariables(index + 1);
        return new Guard(this, factory.ithVar(index));
    }

    /**
     * Guard satisfied by exactly the {@code row}-th valuation of {@code apCount} propositions
     * in ascending binary order, proposition 0 being the most significant bit. Any number of
     * propositions is accepted; only the row must fit.
     */
    public synchronized Guard valuation(long row, int apCount) {
        if (apCount < 0) {
            throw new IllegalArgumentException("Proposition count must be >= 0. Got: " + apCount);
        }
        if (row < 0 || (apCount < Long.SIZE - 1 && row >= (1L << apCount))) {
            throw new IllegalArgumentException("Row " + row + " out of range for " + apCount + " propositions");
        }
        ensureVariables(apCount);
        BDD cube = factory.one();
        for (int ap = 0; ap < apCount; ap++) {
            int shift = apCount - 1 - ap;
            boolean value = shift < Long.SIZE - 1 && ((row >> shift) & 1L) == 1L;
            BDD literal = value ? factory.ithVar(ap) : factory.nithVar(ap);
            cube = cube.andWith(literal);
        }
        return new Guard(this, cube);
    }

    /**
     * The first {@code count} valuations of {@code apCount} propositions, in implicit-label order.
     */
    public List<Guard> valuations(int apCount, int count) {
        List<Guard> rows = new ArrayList<>(count);
        for (long row = 0; row < count; row++) {
            rows.add(valuation(row, apCount));
        }
        return rows;
    }

    /**
     * All valuations of {@code apCount} propositions as guards, in implicit-label order.
     */
    public List<Guard> valuations(int apCount) {
        checkEnumerable(apCount);
        return valuations(apCount, 1 << apCount);
    }

    Guard wrap(BDD bdd) {
        return new Guard(this, bdd);
    }

    BDDFactory factory() {
        return factory;
    }

    private static void checkEnumerable(int apCount) {
        if (apCount < 0 || apCount > MAX_ENUMERABLE_PROPOSITIONS) {
            throw new IllegalArgumentException("Cannot enumerate valuations of " + apCount + " propositions");
        }
    }
}
