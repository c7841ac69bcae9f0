package com.opencrawl.crawl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencrawl.config.CrawlerProperties;
import com.opencrawl.crawl.model.CrawlFailure;
import com.opencrawl.crawl.model.CrawlRequest;
import com.opencrawl.crawl.model.CrawlResponse;
import com.opencrawl.crawl.model.FailureKind;
import com.opencrawl.crawl.output.CrawlResultWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CrawlCliRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void mergesInlineAndFileUrlsWithoutDuplicates() throws Exception {
        Path file = tempDir.resolve("urls.txt");
        Files.writeString(file, "# seeds\nhttps://example.com/b\n\nhttps://example.com/c\n");
        CrawlerProperties.Cli cli = new CrawlerProperties.Cli();
        cli.setUrls("https://example.com/a, https://example.com/b");
        cli.setUrlsFile(file.toString());

        assertThat(CrawlCliRunner.targetUrls(cli))
            .containsExactly("https://example.com/a", "https://example.com/b", "https://example.com/c");
    }

    @Test
    void doesNothingUnlessEnabled() {
        AsyncCrawler crawler = Mockito.mock(AsyncCrawler.class);
        CrawlCliRunner runner = new CrawlCliRunner(
            new CrawlerProperties(),
            crawler,
            new CrawlResultWriter(new ObjectMapper()),
            Mockito.mock(ConfigurableApplicationContext.class)
        );

        runner.run(new DefaultApplicationArguments());

        verify(crawler, never()).setup();
    }

    @Test
    void runsBatchAndWritesResults() throws Exception {
        Path output = tempDir.resolve("out/results.json");
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        properties.getCli().setUrls("https://example.com/a");
        properties.getCli().setOutput(output.toString());

        AsyncCrawler crawler = Mockito.mock(AsyncCrawler.class);
        CrawlResponse failed = CrawlResponse.failure(
            CrawlRequest.of("https://example.com/a"),
            null,
            Duration.ZERO,
            null,
            CrawlFailure.of(FailureKind.DNS_FAILURE, "unknown host", 3)
        );
        when(crawler.fetchMany(anyList())).thenReturn(List.of(failed));
        CrawlCliRunner runner = new CrawlCliRunner(
            properties,
            crawler,
            new CrawlResultWriter(new ObjectMapper()),
            Mockito.mock(ConfigurableApplicationContext.class)
        );

        runner.run(new DefaultApplicationArguments());

        verify(crawler).setup();
        verify(crawler).cleanup();
        assertThat(Files.readString(output))
            .contains("\"url\" : \"https://example.com/a\"")
            .contains("DNS_FAILURE after 3 attempts: unknown host");
    }
}
