package com.omega.hoa.symbolic;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.omega.hoa.model.BooleanFormula;

import net.sf.javabdd.BDD;

/**
 * Canonical boolean function over atomic propositions. Two guards from the same
 * {@link LabelSpace} are equal iff they denote the same function.
 */
public final class Guard {

    private final LabelSpace space;
    private final BDD bdd;

    Guard(LabelSpace space, BDD bdd) {
        this.space = space;
        this.bdd = bdd;
    }

    public LabelSpace getSpace() {
        return space;
    }

    public Guard and(Guard other) {
        checkSameSpace(other);
        synchronized (space) {
            return new Guard(space, bdd.and(other.bdd));
        }
    }

    public Guard or(Guard other) {
        checkSameSpace(other);
        synchronized (space) {
            return new Guard(space, bdd.or(other.bdd));
        }
    }

    public Guard not() {
        synchronized (space) {
            return new Guard(space, bdd.not());
        }
    }

    /**
     * Fixes one proposition to a constant.
     */
    public Guard restrict(int proposition, boolean value) {
        synchronized (space) {
            space.ensureVariables(proposition + 1);
            BDD literal = value ? space.factory().ithVar(proposition) : space.factory().nithVar(proposition);
            BDD restricted = bdd.restrict(literal);
            literal.free();
            return new Guard(space, restricted);
        }
    }

    public boolean isTrue() {
        synchronized (space) {
            return bdd.isOne();
        }
    }

    public boolean isFalse() {
        synchronized (space) {
            return bdd.isZero();
        }
    }

    public boolean intersects(Guard other) {
        checkSameSpace(other);
        synchronized (space) {
            BDD both = bdd.and(other.bdd);
            boolean result = !both.isZero();
            both.free();
            return result;
        }
    }

    /**
     * Truth value under a valuation; bit {@code i} set means proposition {@code i} holds.
     */
    public boolean evaluate(BitSet valuation) {
        synchronized (space) {
            return BddTraversal.evaluate(bdd, valuation::get);
        }
    }

    /**
     * Propositions this guard actually depends on.
     */
    public BitSet support() {
        synchronized (space) {
            return BddTraversal.support(bdd);
        }
    }

    /**
     * Satisfying valuations among {@code apCount} propositions in implicit-label order.
     */
    public List<BitSet> satisfyingValuations(int apCount) {
        if (apCount < 0 || apCount > LabelSpace.MAX_ENUMERABLE_PROPOSITIONS) {
            throw new IllegalArgumentException("Cannot enumerate valuations of " + apCount + " propositions");
        }
        List<BitSet> result;
        synchronized (space) {
            space.ensureVariables(apCount);
            BDD projected = bdd.id();
            BitSet support = BddTraversal.support(bdd);
            for (int ap = support.nextSetBit(apCount); ap >= 0; ap = support.nextSetBit(ap + 1)) {
                BDD literal = space.factory().nithVar(ap);
                BDD restricted = projected.restrict(literal);
                literal.free();
                projected.free();
                projected = restricted;
            }
            result = BddTraversal.minterms(projected, space.factory(), apCount);
            projected.free();
        }
        result.sort(implicitOrder(apCount));
        return result;
    }

    private static Comparator<BitSet> implicitOrder(int apCount) {
        return (left, right) -> {
            for (int ap = 0; ap < apCount; ap++) {
                if (left.get(ap) != right.get(ap)) {
                    return left.get(ap) ? 1 : -1;
                }
            }
            return 0;
        };
    }

    /**
     * Disjunctive normal form read off the diagram's paths; constants fold to {@code t}/{@code f}.
     */
    public BooleanFormula toFormula() {
        List<Map<Integer, Boolean>> cubes;
        synchronized (space) {
            if (bdd.isOne()) {
                return BooleanFormula.TRUE;
            }
            if (bdd.isZero()) {
                return BooleanFormula.FALSE;
            }
            cubes = BddTraversal.paths(bdd);
        }
        List<BooleanFormula> disjuncts = new ArrayList<>();
        for (Map<Integer, Boolean> cube : cubes) {
            List<BooleanFormula> literals = new ArrayList<>();
            cube.forEach((ap, positive) -> literals.add(positive
                    ? BooleanFormula.var(ap)
                    : BooleanFormula.not(BooleanFormula.var(ap))));
            disjuncts.add(literals.size() == 1 ? literals.get(0) : BooleanFormula.and(literals, null));
        }
        return disjuncts.size() == 1 ? disjuncts.get(0) : BooleanFormula.or(disjuncts, null);
    }

    private void checkSameSpace(Guard other) {
        if (other.space != space) {
            throw new IllegalArgumentException("Guards belong to different label spaces");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Guard other && other.space == space && other.bdd.equals(bdd);
    }

    @Override
    public int hashCode() {
        return bdd.hashCode();
    }

    @Override
    public String toString() {
        return toFormula().toString();
    }
}
