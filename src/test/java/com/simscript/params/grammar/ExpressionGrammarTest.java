package com.simscript.params.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.simscript.params.exception.ExpressionSyntaxException;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExpressionGrammar.
 */
class ExpressionGrammarTest {

    @Test
    void testStripTrailingComment() {
        assertThat(ExpressionGrammar.stripComment("1 + 2   # three")).isEqualTo("1 + 2");
        assertThat(ExpressionGrammar.stripComment("no comment")).isEqualTo("no comment");
    }

    @Test
    void testLeadingHashIsKept() {
        assertThat(ExpressionGrammar.stripComment("# Title")).isEqualTo("# Title");
        assertThat(ExpressionGrammar.stripComment("   ## Section")).isEqualTo("   ## Section");
    }

    @Test
    void testEscapedHashIsLiteral() {
        assertThat(ExpressionGrammar.stripComment("color \\#ff0000 # red")).isEqualTo("color #ff0000");
    }

    @Test
    void testStripCommentLineByLine() {
        String text = "a = 1 # first\n# heading\nb = 2 # second";

        assertThat(ExpressionGrammar.stripComment(text)).isEqualTo("a = 1\n# heading\nb = 2");
    }

    @ParameterizedTest
    @CsvSource({
            "'', EMPTY",
            "'   ', EMPTY",
            "'![\"a\", 1]', RECURSIVE_LITERAL",
            "'$units are ${u}', LITERAL",
            "'\\${x} + 1', ESCAPED",
            "'${a}', INTERPOLATION",
            "'${a[1]} * 2', INTERPOLATION",
            "'@{m}.T', INTERPOLATION",
            "'${a*2} + 1', LOCAL_EVALUATION",
            "'1 + 2', FULL_EVALUATION",
            "'$[1 2 3]', FULL_EVALUATION",
            "'sqrt(2)', FULL_EVALUATION"
    })
    void testClassify(String text, ExpressionKind expected) {
        assertThat(ExpressionGrammar.classify(text)).isEqualTo(expected);
    }

    @Test
    void testFindMarkers() {
        List<Marker> markers = ExpressionGrammar.findMarkers("x ${a} y @{b} \\${c}");

        assertThat(markers).hasSize(2);
        assertThat(markers.get(0).getContent()).isEqualTo("a");
        assertThat(markers.get(0).getStart()).isEqualTo(2);
        assertThat(markers.get(0).isArrayCoercing()).isFalse();
        assertThat(markers.get(1).getContent()).isEqualTo("b");
        assertThat(markers.get(1).isArrayCoercing()).isTrue();
        assertThat(markers.get(1).text()).isEqualTo("@{b}");
    }

    @Test
    void testUnterminatedMarker() {
        assertThatThrownBy(() -> ExpressionGrammar.findMarkers("${a} + ${b"))
                .isInstanceOf(ExpressionSyntaxException.class);
        assertThat(ExpressionGrammar.findMarkers("${a} + ${b", true)).hasSize(1);
    }

    @Test
    void testMarkerReferenceShapes() {
        assertThat(new Marker(0, 4, "a", false).isReference()).isTrue();
        assertThat(new Marker(0, 9, "a[1, 2]", false).baseName()).isEqualTo("a");
        assertThat(new Marker(0, 7, "a + 1", false).isReference()).isFalse();
        assertThat(new Marker(0, 7, "a + 1", false).baseName()).isNull();
    }

    @Test
    void testReferences() {
        assertThat(ExpressionGrammar.references("${a} + ${max(b, pi)} + ${a[c]}"))
                .containsExactly("a", "b", "pi", "c");
        assertThat(ExpressionGrammar.references("\\${a} and ${b} # ${c}"))
                .containsExactly("b");
        assertThat(ExpressionGrammar.references("no markers")).isEmpty();
    }

    @Test
    void testIsDynamic() {
        assertThat(ExpressionGrammar.isDynamic("${a} + 1")).isTrue();
        assertThat(ExpressionGrammar.isDynamic("@{m}")).isTrue();
        assertThat(ExpressionGrammar.isDynamic("plain text")).isFalse();
        assertThat(ExpressionGrammar.isDynamic("\\${a}")).isFalse();
        assertThat(ExpressionGrammar.isDynamic("text # ${a}")).isFalse();
        assertThat(ExpressionGrammar.isDynamic(42)).isFalse();
        assertThat(ExpressionGrammar.isDynamic(null)).isFalse();
    }

    @Test
    void testUnescape() {
        assertThat(ExpressionGrammar.unescape("\\${x} and \\@{y}")).isEqualTo("${x} and @{y}");
    }

    @Test
    void testProtectBareNames() {
        String protectedText = ExpressionGrammar.protect("$a + $ab + \\$a + $abc", List.of("a", "ab"));

        assertThat(protectedText).isEqualTo("${a} + ${ab} + \\$a + $abc");
    }

    @Test
    void testIsLiteralText() {
        assertThat(ExpressionGrammar.isLiteralText("$text")).isTrue();
        assertThat(ExpressionGrammar.isLiteralText("${a}")).isFalse();
        assertThat(ExpressionGrammar.isLiteralText("$[1 2]")).isFalse();
    }
}
