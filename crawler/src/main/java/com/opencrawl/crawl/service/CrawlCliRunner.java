package com.opencrawl.crawl.service;

import com.opencrawl.config.CrawlerProperties;
import com.opencrawl.crawl.model.CrawlRequest;
import com.opencrawl.crawl.model.CrawlResponse;
import com.opencrawl.crawl.model.FailureKind;
import com.opencrawl.crawl.output.CrawlResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final AsyncCrawler crawler;
    private final CrawlResultWriter resultWriter;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        AsyncCrawler crawler,
        CrawlResultWriter resultWriter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawler = crawler;
        this.resultWriter = resultWriter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> urls = targetUrls(properties.getCli());
        if (urls.isEmpty()) {
            log.warn("No URLs given; set crawler.cli.urls or crawler.cli.urls-file");
        } else {
            List<CrawlRequest> requests = urls.stream().map(CrawlRequest::of).toList();
            crawler.setup();
            List<CrawlResponse> responses;
            try {
                responses = crawler.fetchMany(requests);
            } finally {
                crawler.cleanup();
            }
            logSummary(responses);
            resultWriter.write(responses, Path.of(properties.getCli().getOutput()));
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static List<String> targetUrls(CrawlerProperties.Cli cli) {
        Set<String> urls = new LinkedHashSet<>();
        if (cli.getUrls() != null) {
            Arrays.stream(cli.getUrls().split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .forEach(urls::add);
        }
        if (cli.getUrlsFile() != null && !cli.getUrlsFile().isBlank()) {
            try {
                for (String line : Files.readAllLines(Path.of(cli.getUrlsFile().trim()))) {
                    String trimmed = line.trim();
                    if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                        urls.add(trimmed);
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read URL file " + cli.getUrlsFile(), e);
            }
        }
        return new ArrayList<>(urls);
    }

    private void logSummary(List<CrawlResponse> responses) {
        long succeeded = responses.stream().filter(CrawlResponse::isSuccess).count();
        Map<FailureKind, Integer> failures = new EnumMap<>(FailureKind.class);
        for (CrawlResponse response : responses) {
            if (!response.isSuccess()) {
                failures.merge(response.error().kind(), 1, Integer::sum);
            }
        }
        log.info("Crawl completed: {}/{} succeeded, failures={}", succeeded, responses.size(), failures);
        for (CrawlResponse response : responses) {
            if (response.isSuccess()) {
                log.info(
                    "Summary {}: status={}, chars={}, links={}, attempts={}",
                    response.url(),
                    response.statusCode(),
                    response.extracted().content().length(),
                    response.extracted().links().size(),
                    response.attempts()
                );
            } else {
                log.info("Summary {}: {}", response.url(), response.error().describe());
            }
        }
    }
}
