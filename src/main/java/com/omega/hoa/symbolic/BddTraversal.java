package com.omega.hoa.symbolic;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntPredicate;
import java.util.stream.IntStream;

import lombok.experimental.UtilityClass;
import net.sf.javabdd.BDD;
import net.sf.javabdd.BDDFactory;
import net.sf.javabdd.BDDVarSet;

/**
 * Reads decision diagrams: evaluation and path listing walk the public node accessors,
 * support and minterms come from the library. Callers hold the owning space's monitor.
 * Relies on the identity variable order, i.e. {@code var()} is the variable index.
 */
@UtilityClass
class BddTraversal {

    boolean evaluate(BDD root, IntPredicate assignment) {
        BDD node = root.id();
        while (!node.isOne() && !node.isZero()) {
            BDD next = assignment.test(node.var()) ? node.high() : node.low();
            node.free();
            node = next;
        }
        boolean result = node.isOne();
        node.free();
        return result;
    }

    BitSet support(BDD root) {
        BDDVarSet variables = root.support();
        BitSet support = new BitSet();
        for (int variable : variables.toArray()) {
            support.set(variable);
        }
        variables.free();
        return support;
    }

    /**
     * Satisfying assignments of {@code root} over variables {@code 0..variableCount-1}, one
     * bit set per variable assigned true. {@code root} must not depend on other variables.
     */
    List<BitSet> minterms(BDD root, BDDFactory factory, int variableCount) {
        List<BitSet> minterms = new ArrayList<>();
        if (root.isZero()) {
            return minterms;
        }
        if (variableCount == 0) {
            minterms.add(new BitSet());
            return minterms;
        }
        BDDVarSet domain = factory.makeSet(IntStream.range(0, variableCount).toArray());
        BDD.BDDIterator iterator = root.iterator(domain);
        while (iterator.hasNext()) {
            BDD minterm = (BDD) iterator.next();
            BitSet assignment = new BitSet(variableCount);
            for (Map<Integer, Boolean> path : paths(minterm)) {
                path.forEach((variable, positive) -> {
                    if (positive) {
                        assignment.set(variable);
                    }
                });
            }
            minterm.free();
            minterms.add(assignment);
        }
        domain.free();
        return minterms;
    }

    /**
     * Paths to the true terminal, each as variable -> polarity, high branches first.
     */
    List<Map<Integer, Boolean>> paths(BDD root) {
        List<Map<Integer, Boolean>> paths = new ArrayList<>();
        collectPaths(root, new TreeMap<>(), paths);
        return paths;
    }

    private void collectPaths(BDD node, TreeMap<Integer, Boolean> path, List<Map<Integer, Boolean>> paths) {
        if (node.isZero()) {
            return;
        }
        if (node.isOne()) {
            paths.add(new TreeMap<>(path));
            return;
        }
        int variable = node.var();
        BDD high = node.high();
        path.put(variable, Boolean.TRUE);
        collectPaths(high, path, paths);
        high.free();

        BDD low = node.low();
        path.put(variable, Boolean.FALSE);
        collectPaths(low, path, paths);
        low.free();
        path.remove(variable);
    }
}
