package com.omega.hoa.symbolic;

import java.util.BitSet;

import com.omega.hoa.model.BooleanFormula;

import net.sf.javabdd.BDD;

/**
 * Acceptance condition in both readable and canonical form. The formula is what the input
 * (or a writer) spells out; equality and evaluation go through the diagram.
 */
public final class AcceptanceCondition {

    private final AcceptanceSpace space;
    private final BDD bdd;
    private final BooleanFormula formula;
    private final int setCount;

    AcceptanceCondition(AcceptanceSpace space, BDD bdd, BooleanFormula formula, int setCount) {
        this.space = space;
        this.bdd = bdd;
        this.formula = formula;
        this.setCount = setCount;
    }

    public BooleanFormula getFormula() {
        return formula;
    }

    public int getSetCount() {
        return setCount;
    }

    public AcceptanceSpace getSpace() {
        return space;
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

    /**
     * Whether some atom speaks about the complement of a set, as in {@code Inf(!0)}.
     */
    public boolean usesComplementedSets() {
        BitSet support;
        synchronized (space) {
            support = BddTraversal.support(bdd);
        }
        for (int variable = support.nextSetBit(0); variable >= 0; variable = support.nextSetBit(variable + 1)) {
            if (AcceptanceSpace.isComplementVariable(variable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates the condition given the sets visited infinitely often. Only defined when no
     * complemented atom occurs; use {@link #isSatisfiedBy(BitSet, BitSet)} otherwise.
     */
    public boolean isSatisfiedBy(BitSet infinitelyOften) {
        if (usesComplementedSets()) {
            throw new IllegalStateException(
                    "Condition refers to complemented sets; supply their valuation as well: " + formula);
        }
        return isSatisfiedBy(infinitelyOften, new BitSet());
    }

    /**
     * @param infinitelyOften     sets {@code i} for which {@code Inf(i)} holds
     * @param complementsInfinitely sets {@code i} for which {@code Inf(!i)} holds
     */
    public boolean isSatisfiedBy(BitSet infinitelyOften, BitSet complementsInfinitely) {
        synchronized (space) {
            return BddTraversal.evaluate(bdd, variable -> {
                int set = AcceptanceSpace.setOf(variable);
                return AcceptanceSpace.isComplementVariable(variable)
                        ? complementsInfinitely.get(set)
                        : infinitelyOften.get(set);
            });
        }
    }

    /**
     * Semantic equivalence, independent of how either formula is spelled.
     */
    public boolean isEquivalentTo(AcceptanceCondition other) {
        if (other.space != space) {
            throw new IllegalArgumentException("Conditions belong to different acceptance spaces");
        }
        synchronized (space) {
            return bdd.equals(other.bdd);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AcceptanceCondition other
                && other.space == space
                && other.setCount == setCount
                && other.bdd.equals(bdd);
    }

    @Override
    public int hashCode() {
        return 31 * bdd.hashCode() + setCount;
    }

    @Override
    public String toString() {
        return setCount + " " + formula;
    }
}
