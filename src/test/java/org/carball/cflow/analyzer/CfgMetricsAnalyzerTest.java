package org.carball.cflow.analyzer;

import org.carball.cflow.config.AnalyzerConfig;
import org.carball.cflow.config.ComplexityThresholds;
import org.carball.cflow.model.analysis.FileAnalysis;
import org.carball.cflow.model.analysis.FunctionResult;
import org.carball.cflow.model.analysis.ProjectAnalysis;
import org.carball.cflow.model.analysis.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CfgMetricsAnalyzerTest {

    @TempDir
    Path tempDir;

    private AnalyzerConfig config;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("src/util"));
        Files.writeString(tempDir.resolve("src/main.c"), """
            int main(void) {
                return helper(2) > 1 ? 0 : 1;
            }
            """);
        Files.writeString(tempDir.resolve("src/util/helper.cpp"), """
            int helper(int n) {
                if (n > 1) {
                    return n * helper(n - 1);
                }
                return 1;
            }
            """);
        Files.writeString(tempDir.resolve("src/README.md"), "int not_code() { return 0; }");

        config = new AnalyzerConfig();
        config.setThresholds(ComplexityThresholds.defaults());
    }

    @Test
    void shouldWalkDirectoriesForSourceExtensionsInSortedOrder() throws IOException {
        // Given
        config.setInputs(List.of(tempDir.resolve("src")));

        // When
        ProjectAnalysis analysis = new CfgMetricsAnalyzer(config).analyze();

        // Then
        assertThat(analysis.files()).extracting(FileAnalysis::path).containsExactly(
                tempDir.resolve("src/main.c").toString(),
                tempDir.resolve("src/util/helper.cpp").toString());
        assertThat(analysis.functionCount()).isEqualTo(2);
        assertThat(analysis.failureCount()).isZero();
        assertThat(analysis.maxComplexity()).isEqualTo(2);
        assertThat(analysis.averageComplexity()).isEqualTo(1.5);
        assertThat(analysis.riskBreakdown()).containsEntry(RiskLevel.LOW, 2L).containsEntry(RiskLevel.HIGH, 0L);
    }

    @Test
    void shouldTakeExplicitFilesRegardlessOfExtension() throws IOException {
        // Given
        config.setInputs(List.of(tempDir.resolve("src/README.md")));

        // When
        ProjectAnalysis analysis = new CfgMetricsAnalyzer(config).analyze();

        // Then
        assertThat(analysis.fileCount()).isEqualTo(1);
        assertThat(analysis.successfulFunctions()).extracting(e -> e.result().name()).containsExactly("not_code");
    }

    @Test
    void shouldNotAnalyzeSameFileTwice() throws IOException {
        config.setInputs(List.of(tempDir.resolve("src"), tempDir.resolve("src/main.c")));

        ProjectAnalysis analysis = new CfgMetricsAnalyzer(config).analyze();

        assertThat(analysis.fileCount()).isEqualTo(2);
    }

    @Test
    void shouldRestrictToConfiguredExtensions() throws IOException {
        // Given
        config.setThresholds(ComplexityThresholds.builder().fileExtensions(List.of(".CPP")).build());
        config.setInputs(List.of(tempDir.resolve("src")));

        // When
        ProjectAnalysis analysis = new CfgMetricsAnalyzer(config).analyze();

        // Then
        assertThat(analysis.files()).extracting(FileAnalysis::path)
                .containsExactly(tempDir.resolve("src/util/helper.cpp").toString());
        assertThat(analysis.successfulFunctions().get(0).report().isRecursive()).isTrue();
    }

    @Test
    void shouldKeepFunctionsOfFileWithInvalidUtf8() throws IOException {
        // Given
        Path latin1 = tempDir.resolve("src/latin1.c");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("/* caf".getBytes(StandardCharsets.US_ASCII));
        bytes.write(0xE9);
        bytes.write(" */\nint f(int x) { if (x) return 1; return 0; }\n".getBytes(StandardCharsets.US_ASCII));
        bytes.write(0xE9);
        bytes.write('\n');
        Files.write(latin1, bytes.toByteArray());
        config.setInputs(List.of(tempDir.resolve("src")));

        // When
        ProjectAnalysis analysis = new CfgMetricsAnalyzer(config).analyze();

        // Then
        assertThat(analysis.unreadableFileCount()).isZero();
        FileAnalysis file = analysis.files().stream()
                .filter(f -> f.path().endsWith("latin1.c")).findFirst().orElseThrow();
        assertThat(file.isReadable()).isTrue();
        assertThat(file.functions()).extracting(FunctionResult::name).containsExactly("f");
        assertThat(file.functions().get(0).report().getCyclomaticComplexity()).isEqualTo(2);
        assertThat(file.anomalies()).hasSize(1);
        assertThat(analysis.functionCount()).isEqualTo(3);
    }

    @Test
    void shouldRecordUnreadableFileInsteadOfFailing() {
        // When
        FileAnalysis unreadable = new CfgMetricsAnalyzer(config).analyzeFile(tempDir.resolve("src"));

        // Then
        assertThat(unreadable.isReadable()).isFalse();
        assertThat(unreadable.functions()).isEmpty();
        assertThat(unreadable.error()).startsWith("could not read file");
    }

    @Test
    void shouldFailForMissingInput() {
        config.setInputs(List.of(tempDir.resolve("missing")));

        assertThatThrownBy(() -> new CfgMetricsAnalyzer(config).analyze())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Input not found");
    }

    @Test
    void shouldFallBackToDefaultThresholds() throws IOException {
        // Given
        AnalyzerConfig bare = new AnalyzerConfig();
        bare.setInputs(List.of(tempDir.resolve("src/main.c")));

        // When
        ProjectAnalysis analysis = new CfgMetricsAnalyzer(bare).analyze();

        // Then
        assertThat(analysis.successfulFunctions()).hasSize(1);
    }
}
