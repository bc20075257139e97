package com.omega.hoa.resolve;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.omega.hoa.diagnostics.Diagnostic;
import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.model.AliasDefinition;
import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.Span;

import static com.omega.hoa.model.BooleanFormula.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AliasResolver.
 */
class AliasResolverTest {

    private final List<AliasDefinition> definitions = new ArrayList<>();
    private final Diagnostics diagnostics = new Diagnostics();

    @Test
    void testChainedAliasesResolveInDeclarationOrder() {
        define("@a", var(0));
        define("@b", and(alias("@a"), var(1)));
        define("@c", not(alias("@b")));

        AliasTable table = resolve();

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(table.size()).isEqualTo(3);
        assertThat(table.get("@b")).contains(and(var(0), var(1)));
        assertThat(table.get("@c")).contains(not(and(var(0), var(1))));
        assertThat(table.asMap()).containsOnlyKeys("@a", "@b", "@c");
    }

    @Test
    void testMutualReferenceIsCycle() {
        define("@a", alias("@b"));
        define("@b", alias("@a"));

        AliasTable table = resolve();

        assertThat(diagnostics.getErrors()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.CYCLIC_ALIAS);
            assertThat(d.getMessage()).isEqualTo("Alias cycle: @a -> @b -> @a");
        });
        assertThat(table.get("@a")).isEmpty();
        assertThat(table.get("@b")).isEmpty();
        assertThat(table.isDeclared("@a")).isTrue();
    }

    @Test
    void testSelfReferenceIsCycle() {
        define("@a", and(alias("@a"), var(0)));

        resolve();

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::getMessage)
                .containsExactly("Alias cycle: @a -> @a");
    }

    @Test
    void testForwardReferenceIsRejected() {
        define("@a", alias("@b"));
        define("@b", var(0));

        AliasTable table = resolve();

        assertThat(diagnostics.getErrors()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.CYCLIC_ALIAS);
            assertThat(d.getMessage()).contains("before its declaration");
            assertThat(d.getHint()).isEqualTo("declare @b before @a");
        });
        assertThat(table.get("@a")).isEmpty();
        assertThat(table.get("@b")).contains(var(0));
    }

    @Test
    void testUnknownAliasInDefinition() {
        define("@a", or(alias("@zz"), var(0)));

        AliasTable table = resolve();

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.UNKNOWN_ALIAS);
        assertThat(table.get("@a")).isEmpty();
    }

    @Test
    void testDuplicateAliasKeepsFirstDefinition() {
        definitions.add(new AliasDefinition("@a", var(0), 0, Span.of(0, 10, 1, 1)));
        definitions.add(new AliasDefinition("@a", var(1), 1, Span.of(11, 21, 2, 1)));

        AliasTable table = resolve();

        assertThat(table.get("@a")).contains(var(0));
        assertThat(diagnostics.getErrors()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.DUPLICATE_ALIAS);
            assertThat(d.getSpans()).extracting(Span::getLine).containsExactly(2, 1);
        });
    }

    @Test
    void testExpandSubstitutesAndReportsUnknown() {
        define("@a", and(var(0), var(1)));
        AliasTable table = resolve();

        BooleanFormula expanded = AliasResolver.expand(or(not(alias("@a")), alias("@nope")), table, diagnostics);

        assertThat(expanded).isEqualTo(or(not(and(var(0), var(1))), FALSE));
        assertThat(diagnostics.getErrors()).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.UNKNOWN_ALIAS);
    }

    @Test
    void testExpandDoesNotRepeatFailedAliasErrors() {
        define("@a", alias("@a"));
        AliasTable table = resolve();
        int errorsAfterResolve = diagnostics.getErrors().size();

        BooleanFormula expanded = AliasResolver.expand(alias("@a"), table, diagnostics);

        assertThat(expanded).isEqualTo(FALSE);
        assertThat(diagnostics.getErrors()).hasSize(errorsAfterResolve);
    }

    @Test
    void testEmptyTable() {
        AliasTable table = AliasTable.empty();

        assertThat(table.size()).isZero();
        assertThat(table.isDeclared("@a")).isFalse();
    }

    private void define(String name, BooleanFormula formula) {
        definitions.add(new AliasDefinition(name, formula, definitions.size(), null));
    }

    private AliasTable resolve() {
        return new AliasResolver().resolve(definitions, diagnostics);
    }
}
