package com.simscript.params.value;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PathValue.
 */
class PathValueTest {

    @ParameterizedTest
    @CsvSource({
            "this/is/mypath//, mylocalfolder/myfile.ext, this/is/mypath/mylocalfolder/myfile.ext",
            "out, run/, out/run/",
            "out/, /run, out/run",
            "/abs, file, /abs/file",
            "., file, file",
            "dir, ., dir"
    })
    void testJoin(String left, String right, String expected) {
        assertThat(PathValue.of(left).join(right).toString()).isEqualTo(expected);
    }

    @Test
    void testJoinResultIsAPath() {
        assertThat((Object) PathValue.of("a").join("b")).isEqualTo(PathValue.of("a/b"));
    }

    @ParameterizedTest
    @CsvSource({
            "a//b/./c, a/b/c",
            "a\\b\\c\\, a/b/c/",
            "/, /",
            "./, .",
            "//x, /x"
    })
    void testToPath(String raw, String expected) {
        assertThat(PathValue.of(raw).toPath().toString()).isEqualTo(expected);
    }

    @Test
    void testAppendKeepsPathType() {
        PathValue path = PathValue.of("case").append("_01.dat");

        assertThat(path.toString()).isEqualTo("case_01.dat");
    }

    @Test
    void testAbsoluteAndTrailing() {
        assertThat(PathValue.of("/data").isAbsolute()).isTrue();
        assertThat(PathValue.of("data").isAbsolute()).isFalse();
        assertThat(PathValue.of("data/").hasTrailingSeparator()).isTrue();
        assertThat(PathValue.of("data").hasTrailingSeparator()).isFalse();
    }

    @Test
    void testNullRejected() {
        assertThatThrownBy(() -> PathValue.of(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEqualityIsTypeSensitive() {
        assertThat((Object) PathValue.of("a")).isNotEqualTo("a");
        assertThat(PathValue.of("a").toString()).isEqualTo("a");
        assertThat(PathValue.of("a").compareTo(PathValue.of("b"))).isNegative();
    }
}
