package com.todotracker.core.io;

import com.todotracker.core.language.LanguageRegistry;
import com.todotracker.core.model.Finding;
import com.todotracker.core.scanner.impl.CommentExtractor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LargeFileReader} and {@link SourceContent}.
 */
class LargeFileReaderTest {

    @TempDir
    Path tempDir;

    private Path writeLargeSource() throws IOException {
        StringBuilder content = new StringBuilder();
        for (int i = 0; content.length() < 400_000; i++) {
            content.append("fn f").append(i).append("() {} ");
            content.append(i % 7 == 0 ? "// TODO(dev): tidy é " + i : "// plain").append('\n');
            if (i % 50 == 0) {
                content.append("/* FIXME: block\n   HACK: second line */\n");
            }
        }
        Path file = tempDir.resolve("big.rs");
        Files.writeString(file, content.toString());
        return file;
    }

    @Test
    void read_aboveThreshold_isMemoryMapped() throws IOException {
        Path file = writeLargeSource();

        SourceContent content = new LargeFileReader().read(file);

        assertThat(content.isMapped()).isTrue();
        assertThat(content.length()).isEqualTo((int) Files.size(file));
    }

    @Test
    void read_belowThreshold_isHeapBacked() throws IOException {
        Path file = tempDir.resolve("small.rs");
        Files.writeString(file, "// TODO: small\n");

        assertThat(new LargeFileReader().read(file).isMapped()).isFalse();
    }

    @Test
    void extract_mappedAndHeapContent_yieldIdenticalFindings() throws IOException {
        Path file = writeLargeSource();
        CommentExtractor extractor = new CommentExtractor();

        SourceContent mapped = new LargeFileReader().read(file);
        SourceContent heap = new LargeFileReader(Long.MAX_VALUE).read(file);
        List<Finding> fromMapped = extractor.extract(file, mapped, LanguageRegistry.RUST);
        List<Finding> fromHeap = extractor.extract(file, heap, LanguageRegistry.RUST);

        assertThat(mapped.isMapped()).isTrue();
        assertThat(heap.isMapped()).isFalse();
        assertThat(fromMapped).isNotEmpty().isEqualTo(fromHeap);
    }

    @Test
    void read_invalidUtf8_throwsEncodingException() throws IOException {
        Path file = tempDir.resolve("latin1.c");
        Files.write(file, "// café\n".getBytes(StandardCharsets.ISO_8859_1));

        assertThatThrownBy(() -> new LargeFileReader().read(file))
            .isInstanceOf(EncodingException.class)
            .satisfies(e -> assertThat(((EncodingException) e).getOffset()).isEqualTo(6));
    }

    @Test
    void read_nulByte_throwsEncodingException() throws IOException {
        Path file = tempDir.resolve("blob.c");
        Files.write(file, new byte[] {'/', '/', 0, 'x'});

        assertThatThrownBy(() -> new LargeFileReader().read(file))
            .isInstanceOf(EncodingException.class)
            .hasMessageContaining("NUL");
    }

    @Test
    void read_invalidUtf8InMappedFile_throwsEncodingException() throws IOException {
        byte[] bytes = new byte[300_000];
        Arrays.fill(bytes, (byte) 'a');
        bytes[299_000] = (byte) 0xC3;
        Path file = tempDir.resolve("big.c");
        Files.write(file, bytes);

        assertThatThrownBy(() -> new LargeFileReader().read(file))
            .isInstanceOf(EncodingException.class);
    }

    @Test
    void readRaw_skipsValidation() throws IOException {
        Path file = tempDir.resolve("blob.c");
        Files.write(file, new byte[] {'/', '/', 0, 'x'});

        assertThat(new LargeFileReader().readRaw(file).length()).isEqualTo(4);
    }

    @Test
    void sourceContent_byteOrderMark_isExcludedFromText() {
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'h', 'i'};

        SourceContent content = SourceContent.ofBytes(bytes);

        assertThat(content.start()).isEqualTo(3);
        assertThat(content.text()).isEqualTo("hi");
    }

    @Test
    void constructor_negativeThreshold_isRejected() {
        assertThatThrownBy(() -> new LargeFileReader(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
