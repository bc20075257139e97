package com.omega.hoa.symbolic;

import java.util.List;

import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.BooleanFormulaVisitor;

import net.sf.javabdd.BDD;
import net.sf.javabdd.BDDFactory;

/**
 * Lowers alias-free formula trees into canonical symbolic values.
 */
public class SymbolicCompiler {

    private final SymbolicContext context;

    public SymbolicCompiler(SymbolicContext context) {
        this.context = context;
    }

    public SymbolicContext getContext() {
        return context;
    }

    /**
     * @throws IllegalArgumentException if the formula still holds alias references or
     *                                  acceptance atoms
     */
    public Guard compileLabel(BooleanFormula formula) {
        LabelSpace space = context.getLabelSpace();
        synchronized (space) {
            BDD bdd = formula.accept(new LabelLowering(space));
            return space.wrap(bdd);
        }
    }

    /**
     * @throws IllegalArgumentException if the formula holds label leaves
     */
    public AcceptanceCondition compileAcceptance(BooleanFormula formula, int setCount) {
        AcceptanceSpace space = context.getAcceptanceSpace();
        synchronized (space) {
            space.ensureSets(setCount);
            BDD bdd = formula.accept(new AcceptanceLowering(space));
            return new AcceptanceCondition(space, bdd, formula, setCount);
        }
    }

    /**
     * Edge guards an implicitly labeled state gets for {@code apCount} propositions, in edge order.
     */
    public List<Guard> implicitGuards(int apCount) {
        return context.getLabelSpace().valuations(apCount);
    }

    /**
     * The first {@code rowCount} implicit-label guards; a state that is not complete needs no more
     * rows than it has edges.
     */
    public List<Guard> implicitGuards(int apCount, int rowCount) {
        return context.getLabelSpace().valuations(apCount, rowCount);
    }

    private abstract static class Lowering implements BooleanFormulaVisitor<BDD> {
        protected abstract BDDFactory factory();

        @Override
        public BDD visit(BooleanFormula.Constant constant) {
            return constant.isValue() ? factory().one() : factory().zero();
        }

        @Override
        public BDD visit(BooleanFormula.Not not) {
            BDD operand = not.getOperand().accept(this);
            BDD result = operand.not();
            operand.free();
            return result;
        }

        @Override
        public BDD visit(BooleanFormula.And and) {
            BDD result = factory().one();
            for (BooleanFormula operand : and.getOperands()) {
                result = result.andWith(operand.accept(this));
            }
            return result;
        }

        @Override
        public BDD visit(BooleanFormula.Or or) {
            BDD result = factory().zero();
            for (BooleanFormula operand : or.getOperands()) {
                result = result.orWith(operand.accept(this));
            }
            return result;
        }
    }

    private static final class LabelLowering extends Lowering {
        private final LabelSpace space;

        LabelLowering(LabelSpace space) {
            this.space = space;
        }

        @Override
        protected BDDFactory factory() {
            return space.factory();
        }

        @Override
        public BDD visit(BooleanFormula.Var var) {
            space.ensureVariables(var.getIndex() + 1);
            return space.factory().ithVar(var.getIndex());
        }

        @Override
        public BDD visit(BooleanFormula.AliasRef alias) {
            throw new IllegalArgumentException("Unresolved alias " + alias.getName() + " in label");
        }

        @Override
        public BDD visit(BooleanFormula.AcceptanceAtom atom) {
            throw new IllegalArgumentException("Acceptance atom " + atom + " in label");
        }
    }

    private static final class AcceptanceLowering extends Lowering {
        private final AcceptanceSpace space;

        AcceptanceLowering(AcceptanceSpace space) {
            this.space = space;
        }

        @Override
        protected BDDFactory factory() {
            return space.factory();
        }

        @Override
        public BDD visit(BooleanFormula.Var var) {
            throw new IllegalArgumentException("Proposition " + var.getIndex() + " in acceptance condition");
        }

        @Override
        public BDD visit(BooleanFormula.AliasRef alias) {
            throw new IllegalArgumentException("Alias " + alias.getName() + " in acceptance condition");
        }

        @Override
        public BDD visit(BooleanFormula.AcceptanceAtom atom) {
            return atom.getType() == BooleanFormula.AcceptanceAtom.Type.INF
                    ? space.inf(atom.getSet(), atom.isComplemented())
                    : space.fin(atom.getSet(), atom.isComplemented());
        }
    }
}
