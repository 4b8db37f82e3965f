package com.todotracker.core.scanner.impl;

import com.todotracker.core.io.SourceContent;
import com.todotracker.core.language.LanguageRegistry;
import com.todotracker.core.language.LanguageSyntax;
import com.todotracker.core.model.Finding;
import com.todotracker.core.model.Tag;
import com.todotracker.core.scanner.ast.CommentRange;
import com.todotracker.core.scanner.ast.CommentRangeParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link AstCommentVerifier}.
 */
class AstCommentVerifierTest {

    private CommentExtractor baseline;
    private AstCommentVerifier verifier;

    @BeforeEach
    void setUp() {
        baseline = new CommentExtractor();
        verifier = new AstCommentVerifier(baseline);
    }

    private List<Finding> run(String source, LanguageSyntax syntax) {
        return verifier.extract(Path.of("sample"), SourceContent.ofString(source), syntax);
    }

    private List<Finding> baseline(String source, LanguageSyntax syntax) {
        return baseline.extract(Path.of("sample"), SourceContent.ofString(source), syntax);
    }

    // ==================== String literals ====================

    @Test
    void extract_rustStringLiteral_isRejected() {
        String source = "fn main() {\n    let s = \"// TODO: not a comment\";\n    // TODO: real\n}\n";

        assertThat(baseline(source, LanguageRegistry.RUST)).hasSize(2);
        assertThat(run(source, LanguageRegistry.RUST))
            .singleElement()
            .satisfies(finding -> {
                assertThat(finding.line()).isEqualTo(3);
                assertThat(finding.message()).isEqualTo("real");
            });
    }

    @Test
    void extract_rustLifetime_doesNotHideComment() {
        String source = "fn f<'a>(x: &'a str) -> &'a str { x } // FIXME: lifetimes\n";

        assertThat(run(source, LanguageRegistry.RUST))
            .extracting(Finding::tag)
            .containsExactly(Tag.FIXME);
    }

    @Test
    void extract_pythonStringLiteral_isRejected() {
        String source = "url = \"http://x/#TODO\"\nlabel = '# HACK: in string'\n# HACK: genuine\n";

        assertThat(baseline(source, LanguageRegistry.PYTHON)).hasSize(3);
        assertThat(run(source, LanguageRegistry.PYTHON))
            .extracting(Finding::line)
            .containsExactly(3);
    }

    @Test
    void extract_pythonDocstringMarker_isRejected() {
        String source = "def f():\n    \"\"\"\n    # TODO: inside docstring\n    \"\"\"\n    return 1  # TODO: after code\n";

        assertThat(run(source, LanguageRegistry.PYTHON))
            .extracting(Finding::line)
            .containsExactly(5);
    }

    @Test
    void extract_javaScriptStringLiterals_areRejected() {
        String source = String.join("\n",
            "const a = '// FIXME: single';",
            "const b = \"/* TODO: double */\";",
            "const c = `// BUG: template`;",
            "// XXX: real one",
            "");

        assertThat(baseline(source, LanguageRegistry.JAVASCRIPT)).hasSize(4);
        assertThat(run(source, LanguageRegistry.JAVASCRIPT))
            .extracting(Finding::tag)
            .containsExactly(Tag.XXX);
    }

    @Test
    void extract_javaScriptRegexWithQuote_keepsFollowingComment() {
        String source = "const re = /'/; // TODO: don't use regex\n";

        assertThat(baseline(source, LanguageRegistry.JAVASCRIPT)).hasSize(1);
        assertThat(run(source, LanguageRegistry.JAVASCRIPT))
            .singleElement()
            .extracting(Finding::message)
            .isEqualTo("don't use regex");
    }

    @Test
    void extract_yamlApostropheInPlainScalar_keepsComment() {
        String source = "owner: Bob's team # TODO: don't hardcode\n";

        assertThat(baseline(source, LanguageRegistry.YAML)).hasSize(1);
        assertThat(run(source, LanguageRegistry.YAML))
            .singleElement()
            .extracting(Finding::message)
            .isEqualTo("don't hardcode");
    }

    @Test
    void extract_yamlQuotedScalar_isRejected() {
        String source = "title: 'FIXME # TODO: quoted' # HACK: real\n";

        assertThat(baseline(source, LanguageRegistry.YAML)).extracting(Finding::tag)
            .containsExactly(Tag.TODO, Tag.HACK);
        assertThat(run(source, LanguageRegistry.YAML))
            .extracting(Finding::tag)
            .containsExactly(Tag.HACK);
    }

    @Test
    void extract_javaStringLiteral_isRejected() {
        String source = String.join("\n",
            "class Sample {",
            "    String url = \"// TODO: not a comment\";",
            "    /* HACK: block */",
            "    void run() { } // TODO: line",
            "}",
            "");

        assertThat(run(source, LanguageRegistry.JAVA))
            .extracting(Finding::tag, Finding::line)
            .containsExactly(
                tuple(Tag.HACK, 3),
                tuple(Tag.TODO, 4));
    }

    @Test
    void extract_multiByteTextBeforeComment_mapsColumnsCorrectly() {
        String source = "let s = \"😀 é\"; // TODO: after emoji\n";

        assertThat(run(source, LanguageRegistry.RUST)).hasSize(1);
        assertThat(verifier.getStats().getDiscarded()).isZero();
    }

    // ==================== Fail-open ====================

    @Test
    void extract_languageWithoutGrammar_keepsCandidates() {
        String source = "-- TODO: sql comment\nSELECT '-- FIXME: literal';\n";

        List<Finding> findings = run(source, LanguageRegistry.SQL);

        assertThat(findings).hasSize(2);
        assertThat(verifier.getStats().getFallbacks()).isEqualTo(1);
    }

    @Test
    void extract_unparseableJava_keepsCandidates() {
        String source = "class Broken {{{ // TODO: still reported\n";

        List<Finding> findings = run(source, LanguageRegistry.JAVA);

        assertThat(findings).hasSize(1);
        assertThat(verifier.getStats().getFallbacks()).isEqualTo(1);
        assertThat(verifier.getStats().getDiscarded()).isZero();
    }

    @Test
    void extract_grammarThrowing_keepsCandidates() {
        CommentRangeParser failing = new CommentRangeParser() {
            @Override
            public List<CommentRange> parse(String source) {
                throw new ParseException("boom");
            }

            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public String getLanguage() {
                return "failing";
            }
        };
        AstCommentVerifier custom = new AstCommentVerifier(baseline, syntax -> Optional.of(failing));

        List<Finding> findings = custom.extract(Path.of("a.go"),
            SourceContent.ofString("// TODO: a\n// FIXME: b\n"), LanguageRegistry.GO);

        assertThat(findings).hasSize(2);
        assertThat(custom.getStats().getFallbacks()).isEqualTo(1);
    }

    @Test
    void verify_noCandidates_skipsParsing() {
        AstCommentVerifier custom = new AstCommentVerifier(baseline, syntax -> {
            throw new AssertionError("grammar must not be resolved");
        });

        List<Finding> findings = custom.verify(Path.of("a.rs"), SourceContent.ofString("fn main() {}\n"),
            LanguageRegistry.RUST, List.of());

        assertThat(findings).isEmpty();
        assertThat(custom.getStats().getCandidates()).isZero();
    }

    @Test
    void verify_neverAddsFindings() {
        String source = "// TODO: one\n// TODO: two\n";
        List<Finding> onlyFirst = baseline(source, LanguageRegistry.C).subList(0, 1);

        List<Finding> verified = verifier.verify(Path.of("a.c"), SourceContent.ofString(source),
            LanguageRegistry.C, onlyFirst);

        assertThat(verified).containsExactlyElementsOf(onlyFirst);
    }

    // ==================== Statistics ====================

    @Test
    void getStats_countsKeptAndDiscarded() {
        run("let s = \"// TODO: no\"; // TODO: yes\n", LanguageRegistry.RUST);

        assertThat(verifier.getStats().getCandidates()).isEqualTo(2);
        assertThat(verifier.getStats().getVerified()).isEqualTo(1);
        assertThat(verifier.getStats().getDiscarded()).isEqualTo(1);
        assertThat(verifier.getStats().accuracyPercentage()).isEqualTo(50.0);
        assertThat(verifier.getStats().getSummary()).contains("Filtered 1 false positives from 2 candidates");
    }

    @Test
    void getId_identifiesVerifier() {
        assertThat(verifier.getId()).isEqualTo("ast-verifier");
        assertThat(verifier.getDisplayName()).isEqualTo("AST Verifier (Comment Extractor)");
    }
}
