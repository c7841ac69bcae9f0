package com.opencrawl.crawl.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencrawl.crawl.model.CrawlResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
public class CrawlResultWriter {
    private static final Logger log = LoggerFactory.getLogger(CrawlResultWriter.class);

    private final ObjectMapper objectMapper;

    public CrawlResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<CrawlResultView> toViews(List<CrawlResponse> responses) {
        return responses.stream().map(CrawlResultView::from).toList();
    }

    public String writeAsString(List<CrawlResponse> responses) {
        try {
            return objectMapper.writeValueAsString(toViews(responses));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialise crawl results", e);
        }
    }

    public void write(List<CrawlResponse> responses, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(output)) {
                objectMapper.writeValue(out, toViews(responses));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write crawl results to " + output, e);
        }
        log.info("Wrote {} results to {}", responses.size(), output);
    }
}
