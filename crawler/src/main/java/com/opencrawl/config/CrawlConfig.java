package com.opencrawl.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.opencrawl.crawl.service.AsyncCrawler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CrawlConfig {

    @Bean
    public CrawlerConfig crawlerConfig(CrawlerProperties properties) {
        return properties.toConfig();
    }

    // setup() is left to the caller so that proxy probing only happens when a crawl runs.
    @Bean(destroyMethod = "cleanup")
    public AsyncCrawler asyncCrawler(CrawlerConfig crawlerConfig) {
        return AsyncCrawler.create(crawlerConfig);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
