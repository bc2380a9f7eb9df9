package io.arithma.core.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.arithma.core.error.ArityException;
import io.arithma.core.error.DomainException;
import io.arithma.core.error.UnknownFunctionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link FunctionRegistry} and the built-in function table. */
@DisplayName("FunctionRegistry")
class FunctionRegistryTest {

    private final FunctionRegistry registry = FunctionRegistry.standard();

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        void standardRegistryIsShared() {
            assertThat(FunctionRegistry.standard()).isSameAs(registry);
        }

        @Test
        void getReturnsRegisteredFunction() {
            assertThat(registry.get("sin")).isPresent();
            assertThat(registry.get("sin").get().arity()).isEqualTo(Arity.fixed(1));
        }

        @Test
        void getReturnsEmptyForUnknown() {
            assertThat(registry.get("erf")).isEmpty();
            assertThat(registry.contains("erf")).isFalse();
        }

        @Test
        void requireThrowsForUnknown() {
            assertThatThrownBy(() -> registry.require("erf"))
                    .isInstanceOf(UnknownFunctionException.class)
                    .hasMessage("Unknown function: erf");
        }

        @Test
        void namesAreReadOnly() {
            assertThat(registry.names()).contains("sin", "frac", "max", "gcd", "dim");
            assertThatThrownBy(() -> registry.names().remove("sin"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        void registersCustomFunction() {
            MathFunction custom = mock(MathFunction.class);
            when(custom.name()).thenReturn("double");
            when(custom.arity()).thenReturn(Arity.fixed(1));
            when(custom.apply(any())).thenReturn(42.0);

            var customRegistry = FunctionRegistry.builder().register(custom).build();

            assertThat(customRegistry.size()).isEqualTo(1);
            assertThat(customRegistry.apply("double", new double[] {21})).isEqualTo(42.0);
            verify(custom).apply(any());
        }

        @Test
        void arityIsCheckedBeforeTheBodyRuns() {
            MathFunction custom = mock(MathFunction.class);
            when(custom.name()).thenReturn("pair");
            when(custom.arity()).thenReturn(Arity.fixed(2));

            var customRegistry = FunctionRegistry.builder().register(custom).build();

            assertThatThrownBy(() -> customRegistry.apply("pair", new double[] {1}))
                    .isInstanceOf(ArityException.class)
                    .hasMessage("Function 'pair' expects 2 arguments but got 1 argument");
            verify(custom, never()).apply(any());
        }

        @Test
        void laterRegistrationReplacesEarlier() {
            var built = FunctionRegistry.builder()
                    .withStandardFunctions()
                    .register(MathFunction.unary("sin", x -> 7.0))
                    .build();

            assertThat(built.apply("sin", new double[] {0})).isEqualTo(7.0);
            assertThat(built.size()).isEqualTo(registry.size());
        }

        @Test
        void rejectsNullFunction() {
            assertThatThrownBy(() -> FunctionRegistry.builder().register(null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("arity")
    class ArityContract {

        @Test
        void fixedAcceptsExactCount() {
            assertThat(Arity.fixed(2).accepts(2)).isTrue();
            assertThat(Arity.fixed(2).accepts(1)).isFalse();
            assertThat(Arity.fixed(1).describe()).isEqualTo("1 argument");
            assertThat(Arity.fixed(2).describe()).isEqualTo("2 arguments");
        }

        @Test
        void variadicAcceptsMinimumOrMore() {
            assertThat(Arity.variadic(2).accepts(5)).isTrue();
            assertThat(Arity.variadic(2).accepts(1)).isFalse();
            assertThat(Arity.variadic(1).describe()).startsWith("at least");
        }

        @Test
        void rejectsNegativeCounts() {
            assertThatThrownBy(() -> Arity.fixed(-1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("built-in functions")
    class BuiltIns {

        @Test
        void trigonometry() {
            assertThat(registry.apply("sin", new double[] {Math.PI / 2})).isCloseTo(1.0, within(1e-12));
            assertThat(registry.apply("cos", new double[] {0})).isEqualTo(1.0);
            assertThat(registry.apply("arctan", new double[] {1})).isCloseTo(Math.PI / 4, within(1e-12));
            assertThat(registry.apply("sec", new double[] {0})).isEqualTo(1.0);
        }

        @Test
        void polesYieldNaN() {
            assertThat(registry.apply("csc", new double[] {0})).isNaN();
            assertThat(registry.apply("cot", new double[] {0})).isNaN();
            assertThat(registry.apply("coth", new double[] {0})).isNaN();
            assertThat(registry.apply("frac", new double[] {1, 0})).isNaN();
        }

        @Test
        void logarithms() {
            assertThat(registry.apply("ln", new double[] {Math.E})).isCloseTo(1.0, within(1e-12));
            assertThat(registry.apply("log", new double[] {1000})).isCloseTo(3.0, within(1e-12));
            assertThat(registry.apply("lg", new double[] {8})).isCloseTo(3.0, within(1e-12));
        }

        @Test
        void sqrtOfNegativeIsDomainError() {
            assertThat(registry.apply("sqrt", new double[] {9})).isEqualTo(3.0);
            assertThatThrownBy(() -> registry.apply("sqrt", new double[] {-1}))
                    .isInstanceOf(DomainException.class);
        }

        @Test
        void aggregates() {
            assertThat(registry.apply("max", new double[] {1, 5, 3})).isEqualTo(5.0);
            assertThat(registry.apply("min", new double[] {4, -2, 3})).isEqualTo(-2.0);
            assertThat(registry.apply("sup", new double[] {2})).isEqualTo(2.0);
            assertThat(registry.apply("det", new double[] {2, 3, 4})).isEqualTo(24.0);
        }

        @Test
        void gcdTruncatesArguments() {
            assertThat(registry.apply("gcd", new double[] {12, 18})).isEqualTo(6.0);
            assertThat(registry.apply("gcd", new double[] {-12.7, 8, 20})).isEqualTo(4.0);
            assertThatThrownBy(() -> registry.apply("gcd", new double[] {12}))
                    .isInstanceOf(ArityException.class);
        }

        @Test
        void constantStubs() {
            assertThat(registry.apply("dim", new double[0])).isEqualTo(1.0);
            assertThat(registry.apply("ker", new double[0])).isEqualTo(0.0);
            assertThat(registry.apply("lim", new double[] {5, 0})).isEqualTo(5.0);
        }
    }
}
