package com.omega.hoa.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Boolean formula tree shared by edge/state labels and acceptance conditions.
 * Labels are built from {@link Var} and {@link AliasRef} leaves, acceptance conditions from
 * {@link AcceptanceAtom} leaves. Source spans are carried for diagnostics but ignored by
 * {@code equals}.
 */
public abstract class BooleanFormula {

    public static final BooleanFormula TRUE = new Constant(true, null);
    public static final BooleanFormula FALSE = new Constant(false, null);

    @Getter
    private final Span span;

    protected BooleanFormula(Span span) {
        this.span = span;
    }

    public abstract <R> R accept(BooleanFormulaVisitor<R> visitor);

    public static BooleanFormula constant(boolean value, Span span) {
        return new Constant(value, span);
    }

    public static BooleanFormula var(int index, Span span) {
        return new Var(index, span);
    }

    public static BooleanFormula var(int index) {
        return new Var(index, null);
    }

    public static BooleanFormula not(BooleanFormula operand, Span span) {
        return new Not(operand, span);
    }

    public static BooleanFormula not(BooleanFormula operand) {
        return new Not(operand, null);
    }

    public static BooleanFormula and(List<BooleanFormula> operands, Span span) {
        return new And(operands, span);
    }

    public static BooleanFormula and(BooleanFormula... operands) {
        return new And(List.of(operands), null);
    }

    public static BooleanFormula or(List<BooleanFormula> operands, Span span) {
        return new Or(operands, span);
    }

    public static BooleanFormula or(BooleanFormula... operands) {
        return new Or(List.of(operands), null);
    }

    public static BooleanFormula alias(String name, Span span) {
        return new AliasRef(name, span);
    }

    public static BooleanFormula alias(String name) {
        return new AliasRef(name, null);
    }

    public static BooleanFormula inf(int set, boolean complemented, Span span) {
        return new AcceptanceAtom(AcceptanceAtom.Type.INF, set, complemented, span);
    }

    public static BooleanFormula inf(int set) {
        return inf(set, false, null);
    }

    public static BooleanFormula fin(int set, boolean complemented, Span span) {
        return new AcceptanceAtom(AcceptanceAtom.Type.FIN, set, complemented, span);
    }

    public static BooleanFormula fin(int set) {
        return fin(set, false, null);
    }

    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Constant extends BooleanFormula {
        private final boolean value;

        Constant(boolean value, Span span) {
            super(span);
            this.value = value;
        }

        @Override
        public <R> R accept(BooleanFormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Atomic proposition reference by declaration index.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Var extends BooleanFormula {
        private final int index;

        Var(int index, Span span) {
            super(span);
            this.index = index;
        }

        @Override
        public <R> R accept(BooleanFormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Not extends BooleanFormula {
        private final BooleanFormula operand;

        Not(BooleanFormula operand, Span span) {
            super(span);
            this.operand = operand;
        }

        @Override
        public <R> R accept(BooleanFormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class And extends BooleanFormula {
        private final List<BooleanFormula> operands;

        And(List<BooleanFormula> operands, Span span) {
            super(span);
            this.operands = List.copyOf(operands);
        }

        @Override
        public <R> R accept(BooleanFormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Or extends BooleanFormula {
        private final List<BooleanFormula> operands;

        Or(List<BooleanFormula> operands, Span span) {
            super(span);
            this.operands = List.copyOf(operands);
        }

        @Override
        public <R> R accept(BooleanFormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Reference to an {@code Alias:} definition; the name keeps its leading {@code @}.
     * Never present after alias resolution.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class AliasRef extends BooleanFormula {
        private final String name;

        AliasRef(String name, Span span) {
            super(span);
            this.name = name;
        }

        @Override
        public <R> R accept(BooleanFormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * {@code Inf(i)}, {@code Fin(i)} or their complemented forms {@code Inf(!i)}, {@code Fin(!i)}.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class AcceptanceAtom extends BooleanFormula {
        public enum Type { INF, FIN }

        private final Type type;
        private final int set;
        private final boolean complemented;

        AcceptanceAtom(Type type, int set, boolean complemented, Span span) {
            super(span);
            this.type = type;
            this.set = set;
            this.complemented = complemented;
        }

        @Override
        public <R> R accept(BooleanFormulaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
