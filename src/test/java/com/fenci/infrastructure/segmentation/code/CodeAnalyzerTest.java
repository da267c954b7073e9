package com.fenci.infrastructure.segmentation.code;

import com.fenci.domain.segment.model.CodeDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CodeAnalyzerTest {

    private CodeAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new CodeAnalyzer(new IndentBlockGrouper(), new BraceBlockGrouper(new BracketSpanExtractor()));
    }

    // ── Dialect detection ──

    @Nested
    @DisplayName("Dialect detection")
    class DialectDetection {

        @Test
        void braces() {
            assertThat(analyzer.detectDialect("int main() {\n}")).isEqualTo(CodeDialect.BRACE_DELIMITED);
        }

        @Test
        void block_headers() {
            assertThat(analyzer.detectDialect("def f():\n    pass")).isEqualTo(CodeDialect.INDENTATION_DELIMITED);
        }

        @Test
        @DisplayName("A scope operator is not a block header")
        void scope_operator() {
            assertThat(analyzer.detectDialect("std::")).isEqualTo(CodeDialect.LINE_BASED);
        }
    }

    // ── Brace-delimited ──

    @Nested
    @DisplayName("Brace-delimited code")
    class BraceDelimited {

        @Test
        void single_line_function() {
            assertThat(analyzer.analyze("int main() { return 0; }"))
                    .containsExactly("int main", "()", "{ return 0; }");
        }

        @Test
        @DisplayName("Directives stand alone and the body is joined into one chunk")
        void multi_line_function() {
            String code = "#include <stdio.h>\n"
                    + "int add(int a, int b) {\n"
                    + "  return a + b;\n"
                    + "}\n";

            assertThat(analyzer.analyze(code)).containsExactly(
                    "#include <stdio.h>",
                    "int add",
                    "(int a, int b)",
                    "{ return a + b; }");
        }

        @Test
        @DisplayName("#include and #define stay standalone ahead of the function")
        void preprocessor_directives() {
            String code = "#include <stdio.h>\n"
                    + "#define MAX 10\n"
                    + "int main() {\n"
                    + "    return 0;\n"
                    + "}\n";

            assertThat(analyzer.analyze(code)).containsExactly(
                    "#include <stdio.h>",
                    "#define MAX 10",
                    "int main",
                    "()",
                    "{ return 0; }");
        }

        @Test
        @DisplayName("A statement after a closed block is a chunk of its own")
        void statement_after_block() {
            String code = "if (x) {\n"
                    + "    foo();\n"
                    + "}\n"
                    + "bar(1);\n";

            assertThat(analyzer.analyze(code)).containsExactly(
                    "if", "(x)", "{ foo(); }",
                    "bar", "(1)", ";");
        }

        @Test
        void unbalanced_code_does_not_fail() {
            assertThat(analyzer.analyze("if (x) {\n  y();\n")).isNotEmpty();
        }
    }

    // ── Indentation-delimited ──

    @Nested
    @DisplayName("Indentation-delimited code")
    class IndentationDelimited {

        @Test
        void header_and_body_join() {
            assertThat(analyzer.analyze("import os\ndef f():\n    return 1\n"))
                    .containsExactly("import os", "def f(): return 1");
        }

        @Test
        @DisplayName("A dedented top-level statement closes the class")
        void class_then_top_level_statement() {
            String code = "class A:\n"
                    + "    def f(self):\n"
                    + "        x = 1\n"
                    + "        return x\n"
                    + "y = 2\n";

            assertThat(analyzer.analyze(code)).containsExactly(
                    "class A:", "def f(self): x = 1", "return x", "y = 2");
        }

        @Test
        void class_with_two_methods() {
            String code = "class A:\n"
                    + "    def f(self):\n"
                    + "        x = 1\n"
                    + "        return x\n"
                    + "    def g(self):\n"
                    + "        pass\n"
                    + "y = 2\n";

            assertThat(analyzer.analyze(code)).containsExactly(
                    "class A:", "def f(self): x = 1", "return x", "def g(self): pass", "y = 2");
        }

        @Test
        @DisplayName("An import inside a block is emitted alone")
        void import_inside_block() {
            String code = "def f():\n"
                    + "    import os\n"
                    + "    return os.name\n";

            assertThat(analyzer.analyze(code)).containsExactly("def f():", "import os", "return os.name");
        }

        @Test
        void blank_lines_skipped() {
            assertThat(analyzer.analyze("def f():\n\n    return 1\n\n"))
                    .containsExactly("def f(): return 1");
        }
    }

    // ── Line-based ──

    @Test
    void plain_lines() {
        assertThat(analyzer.analyze("x = 1\n\ny = 2  \n"))
                .containsExactly("x = 1", "y = 2");
    }

    @Test
    void blank_input() {
        assertThat(analyzer.analyze("  \n ")).isEmpty();
    }
}
