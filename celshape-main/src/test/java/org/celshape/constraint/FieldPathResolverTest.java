package org.celshape.constraint;

import org.celshape.parser.antlr4.Antlr4CelParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldPathResolverTest {

    private final FieldPathResolver resolver = new FieldPathResolver("this");

    @Test
    void selectOnSubject_resolves() {
        assertThat(resolver.resolve(Antlr4CelParser.parseExpression("this.user_name")))
                .contains(FieldPath.of("userName"));
    }

    @Test
    void deepSelect_keepsAllSegments() {
        FieldPath path = resolver.resolve(Antlr4CelParser.parseExpression("this.a.b_c.d")).orElseThrow();

        assertThat(path.segments()).containsExactly("a", "bC", "d");
        assertThat(path.depth()).isEqualTo(3);
        assertThat(path.head()).isEqualTo("a");
        assertThat(path.child()).isEqualTo("bC");
        assertThat(path).hasToString("a.bC.d");
    }

    @Test
    void otherRoots_doNotResolve() {
        assertThat(resolver.resolve(Antlr4CelParser.parseExpression("this"))).isEmpty();
        assertThat(resolver.resolve(Antlr4CelParser.parseExpression("that.a"))).isEmpty();
        assertThat(resolver.resolve(Antlr4CelParser.parseExpression("this.a.size()"))).isEmpty();
        assertThat(resolver.resolve(Antlr4CelParser.parseExpression("this['a']"))).isEmpty();
    }

    @Test
    void topLevelPath_hasNoChild() {
        assertThatThrownBy(() -> FieldPath.of("a").child())
                .isInstanceOf(IllegalStateException.class);
    }
}
