package com.omega.hoa.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import com.omega.hoa.model.AcceptanceNameHint;
import com.omega.hoa.model.BooleanFormula;

import lombok.Value;
import lombok.experimental.UtilityClass;

/**
 * Canonical acceptance conditions of the named schemes an {@code acc-name:} line may carry.
 */
@UtilityClass
public class AcceptanceShapes {

    /**
     * Condition and number of sets a named scheme stands for.
     */
    @Value
    public static class Shape {
        BooleanFormula condition;
        int setCount;
    }

    /**
     * Number of sets the scheme stands for, computed from the parameters alone. Empty when the
     * name is unknown, its parameters do not fit the scheme, or the count overflows.
     */
    public OptionalLong setCount(AcceptanceNameHint hint) {
        if (hint.getName() == null) {
            return OptionalLong.empty();
        }
        List<String> params = hint.getParameters();
        try {
            return switch (hint.getName()) {
                case BUCHI, CO_BUCHI -> params.isEmpty() ? OptionalLong.of(1) : OptionalLong.empty();
                case ALL, NONE -> params.isEmpty() ? OptionalLong.of(0) : OptionalLong.empty();
                case GENERALIZED_BUCHI, GENERALIZED_CO_BUCHI -> single(params)
                        .map(n -> OptionalLong.of(n))
                        .orElse(OptionalLong.empty());
                case STREETT, RABIN -> single(params)
                        .map(pairs -> OptionalLong.of(Math.multiplyExact(2L, pairs)))
                        .orElse(OptionalLong.empty());
                case GENERALIZED_RABIN -> generalizedRabinSetCount(params);
                case PARITY -> parityColors(params)
                        .map(colors -> OptionalLong.of(colors))
                        .orElse(OptionalLong.empty());
            };
        } catch (NumberFormatException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * Empty when the name is unknown or its parameters do not fit the scheme. Callers that
     * cannot trust the parameters compare {@link #setCount} first, since the shape grows with it.
     */
    public Optional<Shape> of(AcceptanceNameHint hint) {
        if (setCount(hint).isEmpty()) {
            return Optional.empty();
        }
        List<String> params = hint.getParameters();
        return switch (hint.getName()) {
            case BUCHI -> Optional.of(new Shape(BooleanFormula.inf(0), 1));
            case CO_BUCHI -> Optional.of(new Shape(BooleanFormula.fin(0), 1));
            case ALL -> Optional.of(new Shape(BooleanFormula.TRUE, 0));
            case NONE -> Optional.of(new Shape(BooleanFormula.FALSE, 0));
            case GENERALIZED_BUCHI -> single(params).map(AcceptanceShapes::generalizedBuchi);
            case GENERALIZED_CO_BUCHI -> single(params).map(AcceptanceShapes::generalizedCoBuchi);
            case STREETT -> single(params).map(AcceptanceShapes::streett);
            case RABIN -> single(params).map(AcceptanceShapes::rabin);
            case GENERALIZED_RABIN -> Optional.of(generalizedRabin(params));
            case PARITY -> parityColors(params)
                    .map(colors -> parity(params.get(0).equals("max"), params.get(1).equals("even"), colors));
        };
    }

    public Shape generalizedBuchi(int n) {
        List<BooleanFormula> conjuncts = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            conjuncts.add(BooleanFormula.inf(i));
        }
        return new Shape(conjunction(conjuncts), n);
    }

    public Shape generalizedCoBuchi(int n) {
        List<BooleanFormula> disjuncts = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            disjuncts.add(BooleanFormula.fin(i));
        }
        return new Shape(disjunction(disjuncts), n);
    }

    public Shape streett(int pairs) {
        List<BooleanFormula> conjuncts = new ArrayList<>();
        for (int i = 0; i < pairs; i++) {
            conjuncts.add(BooleanFormula.or(BooleanFormula.fin(2 * i), BooleanFormula.inf(2 * i + 1)));
        }
        return new Shape(conjunction(conjuncts), Math.multiplyExact(2, pairs));
    }

    public Shape rabin(int pairs) {
        List<BooleanFormula> disjuncts = new ArrayList<>();
        for (int i = 0; i < pairs; i++) {
            disjuncts.add(BooleanFormula.and(BooleanFormula.fin(2 * i), BooleanFormula.inf(2 * i + 1)));
        }
        return new Shape(disjunction(disjuncts), Math.multiplyExact(2, pairs));
    }

    /**
     * {@code parity min|max even|odd n}: the extreme color seen infinitely often decides.
     */
    public Shape parity(boolean max, boolean even, int colors) {
        BooleanFormula rest = null;
        for (int step = colors - 1; step >= 0; step--) {
            int color = max ? colors - 1 - step : step;
            boolean good = (color % 2 == 0) == even;
            if (good) {
                BooleanFormula inf = BooleanFormula.inf(color);
                rest = rest == null ? inf : BooleanFormula.or(inf, rest);
            } else {
                BooleanFormula fin = BooleanFormula.fin(color);
                rest = rest == null ? fin : BooleanFormula.and(fin, rest);
            }
        }
        return new Shape(rest == null ? BooleanFormula.FALSE : rest, colors);
    }

    private Optional<Integer> single(List<String> params) {
        if (params.size() != 1) {
            return Optional.empty();
        }
        return count(params.get(0));
    }

    private Optional<Integer> count(String param) {
        int value = Integer.parseInt(param);
        return value < 0 ? Optional.empty() : Optional.of(value);
    }

    private OptionalLong generalizedRabinSetCount(List<String> params) {
        if (params.isEmpty()) {
            return OptionalLong.empty();
        }
        Optional<Integer> pairs = count(params.get(0));
        if (pairs.isEmpty() || params.size() - 1 != pairs.get()) {
            return OptionalLong.empty();
        }
        long sets = 0;
        for (int i = 1; i < params.size(); i++) {
            Optional<Integer> infSets = count(params.get(i));
            if (infSets.isEmpty()) {
                return OptionalLong.empty();
            }
            sets = Math.addExact(sets, Math.addExact(1L, infSets.get()));
        }
        return OptionalLong.of(sets);
    }

    private Shape generalizedRabin(List<String> params) {
        int pairs = Integer.parseInt(params.get(0));
        List<BooleanFormula> disjuncts = new ArrayList<>();
        int next = 0;
        for (int i = 0; i < pairs; i++) {
            int infSets = Integer.parseInt(params.get(i + 1));
            List<BooleanFormula> conjuncts = new ArrayList<>();
            conjuncts.add(BooleanFormula.fin(next++));
            for (int k = 0; k < infSets; k++) {
                conjuncts.add(BooleanFormula.inf(next++));
            }
            disjuncts.add(conjunction(conjuncts));
        }
        return new Shape(disjunction(disjuncts), next);
    }

    private Optional<Integer> parityColors(List<String> params) {
        if (params.size() != 3) {
            return Optional.empty();
        }
        String order = params.get(0);
        String parity = params.get(1);
        if (!(order.equals("min") || order.equals("max")) || !(parity.equals("even") || parity.equals("odd"))) {
            return Optional.empty();
        }
        return count(params.get(2));
    }

    private BooleanFormula conjunction(List<BooleanFormula> operands) {
        if (operands.isEmpty()) {
            return BooleanFormula.TRUE;
        }
        return operands.size() == 1 ? operands.get(0) : BooleanFormula.and(operands, null);
    }

    private BooleanFormula disjunction(List<BooleanFormula> operands) {
        if (operands.isEmpty()) {
            return BooleanFormula.FALSE;
        }
        return operands.size() == 1 ? operands.get(0) : BooleanFormula.or(operands, null);
    }
}
