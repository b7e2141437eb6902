package org.smileyface.scopedcrawler.sink;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smileyface.scopedcrawler.config.ConfigurationException;
import org.smileyface.scopedcrawler.model.CrawlResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarkdownFileResultSinkTest {

    @TempDir
    Path tmp;

    private static CrawlResult result(String url, String content) {
        return new CrawlResult(url, null, 0, 0.0, content, List.of(), "text/html", null, Instant.now());
    }

    @Test
    void writesContentUnderLastPathSegment() throws Exception {
        Path dir = tmp.resolve("out/nested");
        MarkdownFileResultSink sink = new MarkdownFileResultSink(dir);

        sink.accept(result("https://example.com/news/daily/story-1", "Story one"));
        sink.accept(result("https://example.com/", "Home"));

        assertThat(Files.readString(dir.resolve("story-1.md"))).isEqualTo("Story one");
        assertThat(Files.readString(dir.resolve("index.md"))).isEqualTo("Home");
        assertThat(sink.getResultDir()).isEqualTo(dir);
    }

    @Test
    void resultDirectoryThatIsAFileIsConfigurationError() throws Exception {
        Path file = Files.writeString(tmp.resolve("taken"), "x");
        assertThatThrownBy(() -> new MarkdownFileResultSink(file))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void andThenFeedsBothSinksInOrder() {
        List<String> seen = new ArrayList<>();
        LoggingResultSink logging = new LoggingResultSink();
        ResultSink chain = ((ResultSink) r -> seen.add("first:" + r.url()))
                .andThen(logging)
                .andThen(r -> seen.add("second:" + r.url()));

        chain.accept(result("https://example.com/a", "A"));

        assertThat(seen).containsExactly("first:https://example.com/a", "second:https://example.com/a");
        assertThat(logging.getTotal()).isEqualTo(1);
    }
}
