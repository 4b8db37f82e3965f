package com.todotracker.core.scanner.impl;

import com.todotracker.core.io.SourceContent;
import com.todotracker.core.language.LanguageRegistry;
import com.todotracker.core.language.LanguageSyntax;
import com.todotracker.core.model.CommentSpan;
import com.todotracker.core.model.Finding;
import com.todotracker.core.model.Priority;
import com.todotracker.core.model.Tag;
import com.todotracker.core.scanner.base.TagVocabulary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link CommentExtractor}.
 */
class CommentExtractorTest {

    private final CommentExtractor extractor = new CommentExtractor();

    private List<Finding> extract(String source, LanguageSyntax syntax) {
        return extractor.extract(Path.of("src", "sample"), SourceContent.ofString(source), syntax);
    }

    // ==================== Tag forms ====================

    @Test
    void extract_annotatedLineComment_parsesAllMetadata() {
        String source = "fn main() {\n".repeat(9) + "    // TODO(bob,#7,p:critical): fix race\n";

        List<Finding> findings = extract(source, LanguageRegistry.RUST);

        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.tag()).isEqualTo(Tag.TODO);
        assertThat(finding.author()).isEqualTo("bob");
        assertThat(finding.issue()).isEqualTo("7");
        assertThat(finding.priority()).isEqualTo(Priority.CRITICAL);
        assertThat(finding.line()).isEqualTo(10);
        assertThat(finding.column()).isEqualTo(7);
        assertThat(finding.message()).isEqualTo("fix race");
    }

    @Test
    void extract_singleLineBlockComment_yieldsOneFinding() {
        List<Finding> findings = extract("int x;\n/* HACK: workaround */ int y;\n", LanguageRegistry.C);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.tag()).isEqualTo(Tag.HACK);
            assertThat(finding.line()).isEqualTo(2);
            assertThat(finding.column()).isEqualTo(3);
            assertThat(finding.message()).isEqualTo("workaround");
            assertThat(finding.hasMetadata()).isFalse();
        });
    }

    @Test
    void extract_bareTagWithoutColon_keepsMessage() {
        List<Finding> findings = extract("# FIXME handle empty input\n", LanguageRegistry.PYTHON);

        assertThat(findings).extracting(Finding::tag, Finding::message)
            .containsExactly(tuple(Tag.FIXME, "handle empty input"));
    }

    @Test
    void extract_dashSeparator_isStripped() {
        List<Finding> findings = extract("-- XXX - remove before release\n", LanguageRegistry.SQL);

        assertThat(findings).singleElement()
            .extracting(Finding::message).isEqualTo("remove before release");
    }

    @Test
    void extract_tagWithoutMessage_hasEmptyMessage() {
        List<Finding> findings = extract("x = 1 # TODO\n", LanguageRegistry.RUBY);

        assertThat(findings).singleElement().extracting(Finding::message).isEqualTo("");
    }

    @Test
    void extract_unclosedGroup_isTreatedAsMessage() {
        List<Finding> findings = extract("// BUG(alice unbalanced\n", LanguageRegistry.GO);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.author()).isNull();
            assertThat(finding.message()).isEqualTo("(alice unbalanced");
        });
    }

    @Test
    void extract_tagInsideLongerWord_isIgnored() {
        List<Finding> findings = extract("// TODOS and DEBUGGING and MY_TODO are not tags\n", LanguageRegistry.JAVA);

        assertThat(findings).isEmpty();
    }

    @Test
    void extract_lowerCaseTag_isIgnoredByDefault() {
        assertThat(extract("// todo: later\n", LanguageRegistry.JAVA)).isEmpty();
    }

    @Test
    void extract_caseInsensitiveVocabulary_reportsDeclaredSpelling() {
        CommentExtractor lenient = new CommentExtractor(TagVocabulary.of(List.of("TODO", "Note"), false));

        List<Finding> findings = lenient.extract(Path.of("a.js"),
            SourceContent.ofString("// todo: one\n// NOTE: two\n"), LanguageRegistry.JAVASCRIPT);

        assertThat(findings).extracting(finding -> finding.tag().name()).containsExactly("TODO", "Note");
    }

    @Test
    void extract_lowerCaseDeclaredTag_isReportedAsDeclared() {
        CommentExtractor exact = new CommentExtractor(TagVocabulary.of(List.of("todo"), true));

        List<Finding> findings = exact.extract(Path.of("a.js"),
            SourceContent.ofString("// todo: one\n// TODO: two\n"), LanguageRegistry.JAVASCRIPT);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.tag().name()).isEqualTo("todo");
            assertThat(finding.message()).isEqualTo("one");
        });
    }

    @Test
    void extract_customTag_isReported() {
        CommentExtractor custom = new CommentExtractor(TagVocabulary.defaults().withTags(List.of("SAFETY")));

        List<Finding> findings = custom.extract(Path.of("lib.rs"),
            SourceContent.ofString("// SAFETY: pointer is valid\n"), LanguageRegistry.RUST);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.tag().isCustom()).isTrue();
            assertThat(finding.tag().name()).isEqualTo("SAFETY");
        });
    }

    @Test
    void extract_metadataOrder_doesNotMatter() {
        Finding first = extract("// TODO(alice, #42, p:high): a\n", LanguageRegistry.JAVA).get(0);
        Finding second = extract("// TODO(p:high, #42, alice): a\n", LanguageRegistry.JAVA).get(0);

        assertThat(second.author()).isEqualTo(first.author()).isEqualTo("alice");
        assertThat(second.issue()).isEqualTo(first.issue()).isEqualTo("42");
        assertThat(second.priority()).isEqualTo(first.priority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void extract_reportsFilePathAsGiven() {
        List<Finding> findings = extract("// TODO: x\n", LanguageRegistry.JAVA);

        assertThat(findings.get(0).file()).isEqualTo(Path.of("src", "sample").toString());
    }

    // ==================== State machine ====================

    @Test
    void extract_blockSpanningLines_anchorsEachTagAtItsLine() {
        String source = String.join("\n",
            "/*",
            " * TODO: first",
            " * FIXME: second",
            " * HACK: third",
            " */",
            "int main() {}",
            "");

        List<Finding> findings = extract(source, LanguageRegistry.C);

        assertThat(findings).extracting(Finding::tag, Finding::line, Finding::message).containsExactly(
            tuple(Tag.TODO, 2, "first"),
            tuple(Tag.FIXME, 3, "second"),
            tuple(Tag.HACK, 4, "third"));
    }

    @Test
    void extract_blocksDoNotNest_firstCloseEndsComment() {
        String source = "/* outer /* inner */ TODO: not a comment */\n";

        assertThat(extract(source, LanguageRegistry.C)).isEmpty();
    }

    @Test
    void extract_codeAfterBlockClose_canStartLineComment() {
        String source = "/* a */ x = 1; // BUG: off by one\n";

        List<Finding> findings = extract(source, LanguageRegistry.JAVASCRIPT);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.tag()).isEqualTo(Tag.BUG);
            assertThat(finding.column()).isEqualTo(18);
        });
    }

    @Test
    void extract_blockOpenerInsideLineComment_isIgnored() {
        String source = "// see /* here\nint x; // TODO: still outside\n";

        List<Finding> findings = extract(source, LanguageRegistry.C);

        assertThat(findings).extracting(Finding::line).containsExactly(2);
    }

    @Test
    void extract_codeOutsideComments_isNotScanned() {
        String source = "let TODO = 1;\nlet FIXME = TODO + 1; // plain comment\n";

        assertThat(extract(source, LanguageRegistry.RUST)).isEmpty();
    }

    @Test
    void extract_unterminatedBlock_runsToEndOfContent() {
        String source = "code();\n/* TODO: never closed\nFIXME: still inside";

        List<Finding> findings = extract(source, LanguageRegistry.JAVA);

        assertThat(findings).extracting(Finding::tag, Finding::line).containsExactly(
            tuple(Tag.TODO, 2),
            tuple(Tag.FIXME, 3));
    }

    @Test
    void extract_luaLongComment_winsOverLineMarker() {
        String source = "--[[\nTODO: inside long comment\n]]\nprint(1) -- FIXME: line\n";

        List<Finding> findings = extract(source, LanguageRegistry.LUA);

        assertThat(findings).extracting(Finding::tag, Finding::line).containsExactly(
            tuple(Tag.TODO, 2),
            tuple(Tag.FIXME, 4));
    }

    @Test
    void extract_markupComment_isScanned() {
        String source = "<div>\n  <!-- TODO: add aria label -->\n</div>\n";

        List<Finding> findings = extract(source, LanguageRegistry.MARKUP);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.line()).isEqualTo(2);
            assertThat(finding.column()).isEqualTo(7);
            assertThat(finding.message()).isEqualTo("add aria label");
        });
    }

    @Test
    void extract_crlfLineEndings_areHandled() {
        String source = "int a;\r\n// TODO: windows\r\nint b;\r\n";

        List<Finding> findings = extract(source, LanguageRegistry.CSHARP);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.line()).isEqualTo(2);
            assertThat(finding.message()).isEqualTo("windows");
        });
    }

    @Test
    void extract_multiByteText_reportsByteColumns() {
        // "é" is two bytes in UTF-8
        String source = "// é TODO: accents\n";

        List<Finding> findings = extract(source, LanguageRegistry.JAVA);

        assertThat(findings).singleElement().extracting(Finding::column).isEqualTo(6);
    }

    @Test
    void extract_leadingByteOrderMark_doesNotShiftColumns() {
        byte[] text = "// TODO: bom\n".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[text.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(text, 0, withBom, 3, text.length);

        List<Finding> findings = extractor.extract(Path.of("a.java"), SourceContent.ofBytes(withBom), LanguageRegistry.JAVA);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.line()).isEqualTo(1);
            assertThat(finding.column()).isEqualTo(3);
        });
    }

    @Test
    void extract_multipleTagsOnOneLine_areOrderedByColumn() {
        List<Finding> findings = extract("// TODO: a FIXME: b\n", LanguageRegistry.GO);

        assertThat(findings).extracting(Finding::tag).containsExactly(Tag.TODO, Tag.FIXME);
        assertThat(findings.get(0).column()).isLessThan(findings.get(1).column());
    }

    @Test
    void extract_emptyContent_yieldsNothing() {
        assertThat(extract("", LanguageRegistry.PYTHON)).isEmpty();
    }

    // ==================== Every language ====================

    static Stream<LanguageSyntax> allLanguages() {
        return LanguageRegistry.defaultRegistry().languages().stream();
    }

    @ParameterizedTest
    @MethodSource("allLanguages")
    void extract_genuineComment_isFoundForEveryLanguage(LanguageSyntax syntax) {
        String source = syntax.lineMarker()
            .map(marker -> "x\n" + marker + " TODO: everywhere\n")
            .orElseGet(() -> {
                LanguageSyntax.BlockDelimiters block = syntax.blockDelimiters().orElseThrow();
                return "x\n" + block.open() + " TODO: everywhere " + block.close() + "\n";
            });

        List<Finding> findings = extract(source, syntax);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.tag()).isEqualTo(Tag.TODO);
            assertThat(finding.line()).isEqualTo(2);
            assertThat(finding.message()).isEqualTo("everywhere");
        });
    }

    static Stream<LanguageSyntax> blockLanguages() {
        return allLanguages().filter(LanguageSyntax::hasBlockComments);
    }

    @ParameterizedTest
    @MethodSource("blockLanguages")
    void extract_genuineBlockComment_isFoundForEveryBlockLanguage(LanguageSyntax syntax) {
        LanguageSyntax.BlockDelimiters block = syntax.blockDelimiters().orElseThrow();
        String source = block.open() + "\nFIXME: spans lines\n" + block.close() + "\n";

        assertThat(extract(source, syntax)).singleElement()
            .extracting(Finding::tag, Finding::line)
            .containsExactly(Tag.FIXME, 2);
    }

    // ==================== Spans ====================

    @Test
    void findSpans_reportsLineAndBlockSpans() {
        String source = "a /* one\ntwo */ b // three\n";
        SourceContent content = SourceContent.ofString(source);

        List<CommentSpan> spans = extractor.findSpans(content, LanguageRegistry.C);

        assertThat(spans).containsExactly(
            new CommentSpan(CommentSpan.Kind.BLOCK, 1, 2, 4, 13),
            new CommentSpan(CommentSpan.Kind.LINE, 2, 2, 20, 26));
        assertThat(content.decode(4, 13)).isEqualTo(" one\ntwo ");
        assertThat(content.decode(20, 26)).isEqualTo(" three");
    }

    @Test
    void staticExtract_usesGivenVocabulary() {
        List<Finding> findings = CommentExtractor.extract(SourceContent.ofString("# NOTE: x\n# TODO: y\n"),
            LanguageRegistry.SHELL, TagVocabulary.of(List.of("NOTE"), true));

        assertThat(findings).extracting(finding -> finding.tag().name()).containsExactly("NOTE");
    }
}
