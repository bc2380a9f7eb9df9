package io.arithma.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.within;

import io.arithma.core.engine.Evaluator;
import io.arithma.core.error.ArithmaParseException;
import io.arithma.core.error.ArityException;
import io.arithma.core.error.StructuralParseException;
import io.arithma.core.function.FunctionRegistry;
import io.arithma.core.model.Environment;
import io.arithma.core.model.Node;
import io.arithma.core.model.Token;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Parser}: precedence, function calls, summations and structural errors. */
@DisplayName("Parser")
class ParserTest {

    private static final Node X = new Node.Variable("x");

    private final FunctionRegistry registry = FunctionRegistry.standard();
    private final Parser parser = new Parser(registry);
    private final Evaluator evaluator = new Evaluator(registry);

    private double eval(String input) {
        return evaluator.evaluate(parser.parse(input), new Environment());
    }

    private static Node num(double value) {
        return new Node.Number(value);
    }

    @Nested
    @DisplayName("precedence")
    class Precedence {

        @Test
        void multiplicationBindsTighterThanAddition() {
            assertThat(parser.parse("1 + 2 \\cdot 3"))
                    .isEqualTo(new Node.Add(num(1), new Node.Multiply(num(2), num(3))));
        }

        @Test
        void subtractionIsLeftAssociative() {
            assertThat(eval("10 - 4 - 3")).isEqualTo(3.0);
            assertThat(eval("64 / 4 / 2")).isEqualTo(8.0);
        }

        @Test
        void powerIsRightAssociative() {
            assertThat(eval("2^3^2")).isEqualTo(512.0);
        }

        @Test
        void unaryMinusBindsTighterThanPower() {
            assertThat(parser.parse("-x^2")).isEqualTo(new Node.Power(new Node.Negate(X), num(2)));
            assertThat(eval("-3^2")).isEqualTo(9.0);
        }

        @Test
        void bracketsGroup() {
            assertThat(eval("(1 + 2) \\cdot 3")).isEqualTo(9.0);
            assertThat(eval("{1 + 2} \\cdot 3")).isEqualTo(9.0);
            assertThat(eval("\\left(1 + 2\\right) \\cdot 3")).isEqualTo(9.0);
        }

        @Test
        void comparisonsBindLooserThanArithmetic() {
            assertThat(parser.parse("x + 1 > 2")).isEqualTo(new Node.Greater(new Node.Add(X, num(1)), num(2)));
            assertThat(eval("3 <= 2")).isEqualTo(0.0);
        }

        @Test
        void equationAndEqualityAreDistinct() {
            assertThat(parser.parse("x = 2")).isEqualTo(new Node.Equation(X, num(2)));
            assertThat(parser.parse("x == 2")).isEqualTo(new Node.Equal(X, num(2)));
        }

        @Test
        void equationBindsLoosest() {
            assertThat(parser.parse("x = 1 < 2")).isEqualTo(new Node.Equation(X, new Node.Less(num(1), num(2))));
        }

        @Test
        void implicitMultiplication() {
            assertThat(parser.parse("2x")).isEqualTo(new Node.Multiply(num(2), X));
        }

        @Test
        void reservedConstants() {
            assertThat(parser.parse("e")).isEqualTo(num(Math.E));
            assertThat(parser.parse("PI")).isEqualTo(num(Math.PI));
            assertThat(parser.parse("\\pi")).isEqualTo(num(Math.PI));
        }

        @Test
        void absoluteValue() {
            assertThat(parser.parse("\\left|x - 3\\right|")).isEqualTo(new Node.Abs(new Node.Subtract(X, num(3))));
            assertThat(eval("\\left|-3\\right|")).isEqualTo(3.0);
        }
    }

    @Nested
    @DisplayName("function calls")
    class FunctionCalls {

        @Test
        void singleArgument() {
            assertThat(parser.parse("\\sin(x)")).isEqualTo(new Node.Function("sin", X));
            assertThat(eval("\\sin(\\frac{\\pi}{2})")).isCloseTo(1.0, within(1e-12));
        }

        @Test
        void sqrtBecomesItsOwnNode() {
            assertThat(parser.parse("\\sqrt{x}")).isEqualTo(new Node.Sqrt(X));
        }

        @Test
        void fracTakesTwoBraceGroups() {
            assertThat(parser.parse("\\frac{1}{2}")).isEqualTo(new Node.Function("frac", num(1), num(2)));
            assertThat(eval("\\frac{3 + 1}{2}")).isEqualTo(2.0);
        }

        @Test
        void fixedArityAcceptsCommaSeparatedArguments() {
            assertThat(parser.parse("\\frac{1, 2}")).isEqualTo(parser.parse("\\frac{1}{2}"));
        }

        @Test
        void variadicArguments() {
            assertThat(parser.parse("\\max(1, 5, 3)"))
                    .isEqualTo(new Node.Function("max", num(1), num(5), num(3)));
            assertThat(eval("\\max(\\min(1, 2), 3, -4)")).isEqualTo(3.0);
        }

        @Test
        void argumentsMayBeExpressions() {
            assertThat(eval("\\gcd(2 \\cdot 6, 9 + 9)")).isEqualTo(6.0);
        }

        @Test
        void zeroArityFunctionNeedsNoBrackets() {
            assertThat(parser.parse("\\dim")).isEqualTo(new Node.Function("dim", List.of()));
            assertThat(eval("2 \\cdot \\dim")).isEqualTo(2.0);
        }

        @Test
        void missingArgumentOfFixedArityFunction() {
            assertThatThrownBy(() -> parser.parse("\\frac{3}"))
                    .isInstanceOf(ArityException.class)
                    .hasMessage("Function 'frac' expects 2 arguments but got 1 argument");
        }

        @Test
        void tooManyArguments() {
            assertThatThrownBy(() -> parser.parse("\\sin(1, 2)"))
                    .isInstanceOf(ArityException.class)
                    .hasMessageContaining("'sin' expects 1 argument but got 2 arguments");
        }

        @Test
        void variadicMinimumIsEnforced() {
            assertThatThrownBy(() -> parser.parse("\\gcd(12)")).isInstanceOf(ArityException.class);
        }

        @Test
        void functionWithoutArgumentList() {
            assertThatThrownBy(() -> parser.parse("\\sin x"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessageContaining("must be followed by a bracketed argument list");
        }

        @Test
        void emptyArgument() {
            assertThatThrownBy(() -> parser.parse("\\max(1, )"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessage("Empty argument in call to function 'max'");
        }

        @Test
        void commaOutsideCall() {
            assertThatThrownBy(() -> parser.parse("(1, 2)"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessageContaining("Unexpected ','");
        }
    }

    @Nested
    @DisplayName("summation")
    class Summation {

        @Test
        void bracedBoundsAndParenthesisedBody() {
            var node = parser.parse("\\sum_{i=1}^{n}(i+2)");

            assertThat(node).isEqualTo(new Node.Summation(
                    "i", num(1), new Node.Variable("n"), new Node.Add(new Node.Variable("i"), num(2))));
        }

        @Test
        void bareUpperBoundAndBody() {
            var node = parser.parse("\\sum_{i=1}^3 i");

            assertThat(node).isEqualTo(new Node.Summation("i", num(1), num(3), new Node.Variable("i")));
        }

        @Test
        void explicitTimesAfterBareUpperBoundIsRejected() {
            assertThatThrownBy(() -> parser.parse("\\sum_{i=1}^3 * i"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessage("Summation body can't start with '*'");
        }

        @Test
        void equationWithSummationOnTheLeft() {
            var node = parser.parse("\\sum_{i=1}^{3}{i} = 6");

            assertThat(node).isInstanceOf(Node.Equation.class);
            assertThat(((Node.Equation) node).left()).isInstanceOf(Node.Summation.class);
            assertThat(((Node.Equation) node).right()).isEqualTo(num(6));
        }

        @Test
        void missingBody() {
            assertThatThrownBy(() -> parser.parse("\\sum_{i=1}^{3}"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessage("Missing summation body");
        }

        @Test
        void indexMustBeAName() {
            assertThatThrownBy(() -> parser.parse("\\sum_{1=1}^{3}{i}"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessageContaining("Expected index variable");
        }

        @Test
        void nothingMayPrecedeTheSum() {
            assertThatThrownBy(() -> parser.parse("x + \\sum_{i=1}^{3}{i}"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessageContaining("before \\sum");
        }

        @Test
        void trailingTokensAreRejected() {
            assertThatThrownBy(() -> parser.parse("\\sum_{i=1}^{3}{i} + 1"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessageContaining("Unexpected tokens after summation");
        }

        @Test
        void errorsInsidePartsNameThePart() {
            assertThatThrownBy(() -> parser.parse("\\sum_{i=1 +}^{3}{i}"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessageStartingWith("Error in summation lower bound:");
        }
    }

    @Nested
    @DisplayName("structural errors")
    class StructuralErrors {

        @Test
        void unclosedBracket() {
            assertThatThrownBy(() -> parser.parse("(1 + 2"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessage("Mismatched parentheses or braces");
        }

        @Test
        void unopenedBracket() {
            assertThatThrownBy(() -> parser.parse("1 + 2)")).isInstanceOf(StructuralParseException.class);
        }

        @Test
        void mismatchedBracketKinds() {
            assertThatThrownBy(() -> parser.parse("(1 + 2}")).isInstanceOf(StructuralParseException.class);
        }

        @Test
        void unmatchedAbsoluteValue() {
            assertThatThrownBy(() -> parser.parse("x\\right|")).isInstanceOf(StructuralParseException.class);
        }

        @Test
        void missingOperand() {
            assertThatThrownBy(() -> parser.parse("1 +"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessageContaining("Not enough operands");
        }

        @Test
        void leftoverOperands() {
            assertThatThrownBy(() -> parser.parse("1 2"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessage("The expression did not resolve into a single tree");
        }

        @Test
        void emptyInput() {
            assertThatThrownBy(() -> parser.parse("")).isInstanceOf(StructuralParseException.class);
        }

        @Test
        void unknownCharacter() {
            assertThatThrownBy(() -> parser.parse("1 # 2"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessage("Unknown token '#'");
        }

        @Test
        void logicalOperatorsAreNotSupported() {
            assertThatThrownBy(() -> parser.parse("a && b"))
                    .isInstanceOf(StructuralParseException.class)
                    .hasMessage("Unsupported operator '&&'");
        }

        @Test
        void errorsCarryTheExpression() {
            Throwable thrown = catchThrowable(() -> parser.parse("(x"));

            assertThat(thrown).isInstanceOf(ArithmaParseException.class);
            assertThat(((ArithmaParseException) thrown).expression()).isEqualTo("(x");
        }
    }

    @Nested
    @DisplayName("stages")
    class Stages {

        @Test
        void postfixOrder() {
            var tokens = new Tokenizer(registry).tokenize("1 + 2 \\cdot 3");
            List<String> postfix =
                    parser.toPostfix(tokens).stream().map(Token::text).collect(Collectors.toList());

            assertThat(postfix).containsExactly("1", "2", "3", "*", "+");
        }

        @Test
        void buildTreeFromPostfix() {
            var postfix = List.of(Token.number("4"), new Token(Token.Type.NEG, Token.NEG));

            assertThat(parser.buildTree(postfix)).isEqualTo(new Node.Negate(num(4)));
        }
    }
}
