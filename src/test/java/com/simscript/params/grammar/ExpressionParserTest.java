package com.simscript.params.grammar;

import org.junit.jupiter.api.Test;

import com.simscript.params.exception.ExpressionSyntaxException;
import com.simscript.params.grammar.ExpressionToken.TokenType;
import com.simscript.params.grammar.ast.AttributeNode;
import com.simscript.params.grammar.ast.BinaryNode;
import com.simscript.params.grammar.ast.CallNode;
import com.simscript.params.grammar.ast.ExprNode;
import com.simscript.params.grammar.ast.IndexNode;
import com.simscript.params.grammar.ast.ListNode;
import com.simscript.params.grammar.ast.LiteralNode;
import com.simscript.params.grammar.ast.NameNode;
import com.simscript.params.grammar.ast.Operator;
import com.simscript.params.grammar.ast.SliceNode;
import com.simscript.params.grammar.ast.UnaryNode;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExpressionTokenizer and ExpressionParser.
 */
class ExpressionParserTest {

    @Test
    void testTokenizeOperators() {
        List<ExpressionToken> tokens = new ExpressionTokenizer("a ** 2 ^ b // 3 @ m").tokenize();

        assertThat(tokens).extracting(ExpressionToken::getType).containsExactly(
                TokenType.IDENTIFIER, TokenType.POWER, TokenType.NUMBER, TokenType.POWER,
                TokenType.IDENTIFIER, TokenType.DOUBLE_SLASH, TokenType.NUMBER, TokenType.AT,
                TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void testTokenizeNumbers() {
        List<ExpressionToken> tokens = new ExpressionTokenizer("1.5e-3 .5 2. 1.T").tokenize();

        assertThat(tokens).extracting(ExpressionToken::getValue)
                .containsExactly("1.5e-3", ".5", "2.", "1", ".", "T", "");
    }

    @Test
    void testTokenizeStrings() {
        List<ExpressionToken> tokens = new ExpressionTokenizer("'it\\'s' \"a\\nb\"").tokenize();

        assertThat(tokens.get(0).getValue()).isEqualTo("it's");
        assertThat(tokens.get(1).getValue()).isEqualTo("a\nb");
        assertThat(tokens.get(1).is(TokenType.STRING)).isTrue();
    }

    @Test
    void testTokenizerRejectsBadInput() {
        assertThatThrownBy(() -> new ExpressionTokenizer("2x").tokenize())
                .isInstanceOf(ExpressionSyntaxException.class);
        assertThatThrownBy(() -> new ExpressionTokenizer("a $ b").tokenize())
                .isInstanceOf(ExpressionSyntaxException.class);
        assertThatThrownBy(() -> new ExpressionTokenizer("'open").tokenize())
                .isInstanceOf(ExpressionSyntaxException.class);
    }

    @Test
    void testPrecedence() {
        ExprNode node = ExpressionParser.parse("1 + 2 * 3");

        assertThat(node).isInstanceOf(BinaryNode.class);
        BinaryNode sum = (BinaryNode) node;
        assertThat(sum.getOperator()).isEqualTo(Operator.ADD);
        assertThat(((BinaryNode) sum.getRight()).getOperator()).isEqualTo(Operator.MULTIPLY);
    }

    @Test
    void testPowerBindsTighterThanUnaryMinus() {
        ExprNode node = ExpressionParser.parse("-2 ** 2");

        assertThat(node).isInstanceOf(UnaryNode.class);
        assertThat(((UnaryNode) node).getOperand()).isInstanceOf(BinaryNode.class);
    }

    @Test
    void testPowerIsRightAssociative() {
        BinaryNode node = (BinaryNode) ExpressionParser.parse("2 ^ 3 ^ 2");

        assertThat(node.getLeft()).isInstanceOf(LiteralNode.class);
        assertThat(node.getRight()).isInstanceOf(BinaryNode.class);
    }

    @Test
    void testCallsSubscriptsAndAttributes() {
        ExprNode node = ExpressionParser.parse("max(a[1:, 0], m.T)");

        assertThat(node).isInstanceOf(CallNode.class);
        CallNode call = (CallNode) node;
        assertThat(call.getFunction()).isEqualTo("max");
        assertThat(call.getArguments()).hasSize(2);

        IndexNode index = (IndexNode) call.getArguments().get(0);
        assertThat(index.getTarget()).isEqualTo(new NameNode("a", 4));
        assertThat(index.getIndices().get(0)).isInstanceOf(SliceNode.class);
        SliceNode slice = (SliceNode) index.getIndices().get(0);
        assertThat(slice.getStart()).isInstanceOf(LiteralNode.class);
        assertThat(slice.getStop()).isNull();

        AttributeNode attribute = (AttributeNode) call.getArguments().get(1);
        assertThat(attribute.getAttribute()).isEqualTo("T");
    }

    @Test
    void testSequences() {
        assertThat(ExpressionParser.parse("1, 2, 3")).isInstanceOf(ListNode.class);
        assertThat(((ListNode) ExpressionParser.parse("[1, [2, 3]]")).getItems()).hasSize(2);
        assertThat(((ListNode) ExpressionParser.parse("(1, 2)")).getItems()).hasSize(2);
        assertThat(ExpressionParser.parse("(1)")).isInstanceOf(LiteralNode.class);
    }

    @Test
    void testBooleans() {
        LiteralNode node = (LiteralNode) ExpressionParser.parse("True");

        assertThat(node.getValue()).isEqualTo(Boolean.TRUE);
    }

    @Test
    void testSyntaxErrors() {
        assertThatThrownBy(() -> ExpressionParser.parse(""))
                .isInstanceOf(ExpressionSyntaxException.class);
        assertThatThrownBy(() -> ExpressionParser.parse("1 +"))
                .isInstanceOf(ExpressionSyntaxException.class);
        assertThatThrownBy(() -> ExpressionParser.parse("(1 + 2"))
                .isInstanceOf(ExpressionSyntaxException.class);
        assertThatThrownBy(() -> ExpressionParser.parse("mesh size 2"))
                .isInstanceOf(ExpressionSyntaxException.class);
    }

    @Test
    void testNestingDepthIsBounded() {
        String nested = "(".repeat(100) + "1" + ")".repeat(100);
        String tooDeep = "(".repeat(20_000) + "1" + ")".repeat(20_000);
        String longChain = "1" + "+1".repeat(20_000);

        assertThat(ExpressionParser.parse(nested)).isNotNull();
        assertThatThrownBy(() -> ExpressionParser.parse(tooDeep))
                .isInstanceOf(ExpressionSyntaxException.class)
                .hasMessageContaining("nested deeper");
        assertThatThrownBy(() -> ExpressionParser.parse("-".repeat(20_000) + "1"))
                .isInstanceOf(ExpressionSyntaxException.class);
        assertThatThrownBy(() -> ExpressionParser.parse(longChain))
                .isInstanceOf(ExpressionSyntaxException.class);
    }

    @Test
    void testNameCollector() {
        assertThat(NameCollector.collect(ExpressionParser.parse("sqrt(a) + b[i:j] * a")))
                .containsExactly("a", "b", "i", "j");
    }

    @Test
    void testLiteralReader() {
        assertThat(LiteralReader.read("[1, -2, 'x', [True]]"))
                .isEqualTo(List.of(1.0, -2.0, "x", List.of(true)));
        assertThatThrownBy(() -> LiteralReader.read("[a]"))
                .isInstanceOf(ExpressionSyntaxException.class);
    }
}
