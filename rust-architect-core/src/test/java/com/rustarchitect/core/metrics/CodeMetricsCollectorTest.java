package com.rustarchitect.core.metrics;

import com.rustarchitect.core.model.CodeMetrics;
import com.rustarchitect.core.scanner.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CodeMetricsCollector}.
 */
class CodeMetricsCollectorTest {

    private final CodeMetricsCollector collector = new CodeMetricsCollector();

    @Test
    void collect_classifiesCodeCommentAndBlankLines() {
        // Given
        SourceFile lib = new SourceFile("src/lib.rs", """
            //! Crate docs
            /// Item docs
            pub fn run() {

                /* inline block */
                let x = 1; // trailing comment is code
            }
            """);
        SourceFile empty = new SourceFile("src/empty.rs", "");

        // When
        CodeMetrics metrics = collector.collect(List.of(lib, empty));

        // Then
        assertThat(metrics).isEqualTo(new CodeMetrics(2, 7, 3, 3, 1));
    }

    @Test
    void collect_withNoFiles_returnsZeros() {
        assertThat(collector.collect(List.of())).isEqualTo(CodeMetrics.empty());
    }
}
