package com.libragraph.relay.core.output;

import com.libragraph.relay.core.backend.ExecutionRecord;
import com.libragraph.relay.core.backend.OutputEntry;
import com.libragraph.relay.types.OutputKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OutputResolverTest {

    @TempDir
    Path tempDir;

    private Path outputRoot;
    private OutputResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        outputRoot = Files.createDirectories(tempDir.resolve("output"));
        resolver = new OutputResolver(outputRoot);
    }

    private static ExecutionRecord success(OutputEntry... entries) {
        return new ExecutionRecord("exec-1", "success", true, true, List.of(entries), null);
    }

    private Path touch(String relative) throws Exception {
        Path file = outputRoot.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{1, 2, 3});
        return file;
    }

    @Test
    void firstExistingEntryWins() throws Exception {
        touch("td_output/abcd1234_00001.mp4");
        Path png = touch("td_output/abcd1234_00001.png");

        Path resolved = resolver.resolve(success(
                new OutputEntry("9", "abcd1234_00001.png", "td_output", OutputKind.IMAGE),
                new OutputEntry("9", "abcd1234_00001.mp4", "td_output", OutputKind.VIDEO)));

        assertThat(resolved).isEqualTo(png);
    }

    @Test
    void missingEntriesAreSkipped() throws Exception {
        Path gif = touch("abcd1234_00001.gif");

        Path resolved = resolver.resolve(success(
                new OutputEntry("9", "gone.png", "td_output", OutputKind.IMAGE),
                new OutputEntry("241", "abcd1234_00001.gif", "", OutputKind.GIF)));

        assertThat(resolved).isEqualTo(gif);
    }

    @Test
    void noExistingFileIsNoOutputProduced() {
        assertThatThrownBy(() -> resolver.resolve(success(
                new OutputEntry("9", "gone.png", "", OutputKind.IMAGE))))
                .isInstanceOf(NoOutputProducedException.class)
                .hasMessageContaining("exec-1")
                .satisfies(e -> assertThat(((NoOutputProducedException) e).kind()).isEqualTo("NoOutputProduced"));
    }

    @Test
    void emptyManifestIsNoOutputProduced() {
        assertThatThrownBy(() -> resolver.resolve(success()))
                .isInstanceOf(NoOutputProducedException.class);
    }

    @Test
    void pathsEscapingTheRootAreIgnored() throws Exception {
        Files.write(tempDir.resolve("secret.png"), new byte[]{1});

        assertThat(resolver.resolveAll(success(
                new OutputEntry("9", "secret.png", "..", OutputKind.IMAGE)))).isEmpty();
    }

    @Test
    void malformedFilenameIsSkipped() throws Exception {
        Path video = Files.createDirectories(outputRoot.resolve("td_output")).resolve("abcd1234_00001.mp4");
        Files.write(video, new byte[]{1});

        assertThat(resolver.resolve(success(
                new OutputEntry("9", "bad\u0000name.png", "td_output", OutputKind.IMAGE),
                new OutputEntry("241", "abcd1234_00001.mp4", "td_output", OutputKind.VIDEO))))
                .isEqualTo(video);
    }

    @Test
    void directoriesAreNotOutputs() throws Exception {
        Files.createDirectories(outputRoot.resolve("td_output/abcd1234.mp4"));

        assertThat(resolver.resolveAll(success(
                new OutputEntry("9", "abcd1234.mp4", "td_output", OutputKind.VIDEO)))).isEmpty();
    }

    @Test
    void resolveAllKeepsManifestOrder() throws Exception {
        touch("a.png");
        touch("b.mp4");

        List<ResolvedOutput> all = resolver.resolveAll(success(
                new OutputEntry("1", "a.png", "", OutputKind.IMAGE),
                new OutputEntry("1", "missing.webm", "", OutputKind.VIDEO),
                new OutputEntry("2", "b.mp4", "", OutputKind.VIDEO)));

        assertThat(all).extracting(ResolvedOutput::nodeId).containsExactly("1", "2");
        assertThat(all).extracting(ResolvedOutput::kind).containsExactly(OutputKind.IMAGE, OutputKind.VIDEO);
    }
}
