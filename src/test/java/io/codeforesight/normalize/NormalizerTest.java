package io.codeforesight.normalize;

import io.codeforesight.model.Language;
import io.codeforesight.model.Snippet;
import io.codeforesight.model.SourceUnit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizerTest {

    private final Normalizer normalizer = new Normalizer(40);

    @Test
    void normalize_emptyInputYieldsNoSnippetsAndIsNotDegraded() {
        SourceUnit unit = normalizer.normalize("empty.c", "  \n\t\n", Language.C);

        assertThat(unit.snippets()).isEmpty();
        assertThat(unit.degraded()).isFalse();
        assertThat(unit.isEmpty()).isTrue();
    }

    @Test
    void normalize_splitsCFunctionsWithExactLines() {
        String source = """
                #include <stdio.h>

                static int add(int a, int b) {
                    return a + b;
                }

                int main(void) {
                    printf("%d\\n", add(1, 2));
                    return 0;
                }
                """;

        SourceUnit unit = normalizer.normalize("demo.c", source, Language.C);

        assertThat(unit.degraded()).isFalse();
        assertThat(unit.functionNames()).containsExactly("add", "main");

        Snippet add = function(unit, "add");
        assertThat(add.startLine()).isEqualTo(3);
        assertThat(add.endLine()).isEqualTo(5);
        assertThat(source.substring(add.startOffset(), add.endOffset())).isEqualTo(add.text());
        assertThat(add.text()).startsWith("static int add").endsWith("}");

        Snippet main = function(unit, "main");
        assertThat(main.startLine()).isEqualTo(7);
        assertThat(main.endLine()).isEqualTo(10);
    }

    @Test
    void normalize_keepsTopLevelCodeAsSnippetWithoutFunction() {
        String source = """
                #include <string.h>
                static const char *password = "secret";

                void f(void) {
                }
                """;

        SourceUnit unit = normalizer.normalize("globals.c", source, Language.C);

        assertThat(unit.snippets()).hasSize(2);
        Snippet top = unit.snippets().get(0);
        assertThat(top.functionName()).isNull();
        assertThat(top.startLine()).isEqualTo(1);
        assertThat(top.text()).contains("password");
    }

    @Test
    void normalize_ignoresBracesInsideStringsAndComments() {
        String source = """
                void f(void) {
                    // closing } in a comment
                    const char *s = "{ not a block";
                    char c = '}';
                }
                """;

        SourceUnit unit = normalizer.normalize("masked.c", source, Language.C);

        assertThat(unit.degraded()).isFalse();
        assertThat(unit.functionNames()).containsExactly("f");
        assertThat(function(unit, "f").endLine()).isEqualTo(5);
    }

    @Test
    void normalize_javaTextBlocksKeepFunctionGranularity() {
        String source = """
                class Queries {
                    String query(String id) {
                        return \"""
                            SELECT * FROM users
                            WHERE id = '{" + id + "}' \\""
                            \""";
                    }

                    int count() {
                        return 1;
                    }
                }
                """;

        SourceUnit unit = normalizer.normalize("Queries.java", source, Language.JAVA);

        assertThat(unit.degraded()).isFalse();
        assertThat(unit.functionNames()).containsExactly("query", "count");
        assertThat(function(unit, "query").endLine()).isEqualTo(7);
    }

    @Test
    void normalize_unterminatedTextBlockIsDegraded() {
        String source = "class A {\n    String s = \"\"\"\n        never closed\n}\n";

        SourceUnit unit = normalizer.normalize("A.java", source, Language.JAVA);

        assertThat(unit.degraded()).isTrue();
    }

    @Test
    void normalize_doesNotTreatControlStatementsAsFunctions() {
        String source = """
                int g(int x) {
                    if (x > 0) {
                        while (x--) {
                        }
                    }
                    return x;
                }
                """;

        SourceUnit unit = normalizer.normalize("control.c", source, Language.C);

        assertThat(unit.functionNames()).containsExactly("g");
    }

    @Test
    void normalize_unbalancedBracesFallBackToLexicalScan() {
        StringBuilder source = new StringBuilder("void broken(void) {\n");
        for (int i = 0; i < 90; i++) {
            source.append("    call_").append(i).append("();\n");
        }

        SourceUnit unit = normalizer.normalize("broken.c", source.toString(), Language.C);

        assertThat(unit.degraded()).isTrue();
        // 91 lines in windows of 40
        assertThat(unit.snippets()).hasSize(3);
        assertThat(unit.snippets()).allMatch(s -> s.functionName() == null);
        assertThat(unit.snippets().get(0).startLine()).isEqualTo(1);
        assertThat(unit.snippets().get(1).startLine()).isEqualTo(41);
        assertThat(unit.snippets().get(2).endLine()).isEqualTo(91);
    }

    @Test
    void normalize_unterminatedCommentIsDegraded() {
        SourceUnit unit = normalizer.normalize("comment.c", "int x;\n/* never closed\nint y;\n", Language.C);

        assertThat(unit.degraded()).isTrue();
        assertThat(unit.snippets()).isNotEmpty();
    }

    @Test
    void normalize_unsupportedLanguageUsesLexicalScan() {
        SourceUnit unit = normalizer.normalize("script.rb", "def foo\n  puts 'x'\nend\n", Language.OTHER);

        assertThat(unit.degraded()).isTrue();
        assertThat(unit.snippets()).hasSize(1);
        assertThat(unit.snippets().get(0).endLine()).isEqualTo(3);
    }

    @Test
    void normalize_splitsPythonFunctionsByIndentation() {
        String source = """
                import os

                def load(path):
                    with open(path) as f:
                        return f.read()

                def run(cmd):
                    os.system(cmd)

                print("done")
                """;

        SourceUnit unit = normalizer.normalize("tool.py", source, Language.PYTHON);

        assertThat(unit.degraded()).isFalse();
        assertThat(unit.functionNames()).containsExactly("load", "run");
        Snippet load = function(unit, "load");
        assertThat(load.startLine()).isEqualTo(3);
        assertThat(load.endLine()).isEqualTo(5);
        assertThat(function(unit, "run").text()).contains("os.system(cmd)");
    }

    @Test
    void normalize_snippetsAreOrderedByOffset() {
        String source = """
                int a(void) { return 1; }
                int b(void) { return 2; }
                int c(void) { return 3; }
                """;

        List<Snippet> snippets = normalizer.normalize("abc.c", source, Language.C).snippets();

        assertThat(snippets).extracting(Snippet::functionName).containsExactly("a", "b", "c");
        assertThat(snippets).isSortedAccordingTo((x, y) -> Integer.compare(x.startOffset(), y.startOffset()));
    }

    private static Snippet function(SourceUnit unit, String name) {
        return unit.snippets().stream()
                .filter(s -> name.equals(s.functionName()))
                .findFirst()
                .orElseThrow();
    }
}
