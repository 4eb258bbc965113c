package com.siteaudit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.siteaudit.crawl.http.PageFetcher;
import com.siteaudit.crawl.page.PageAnalyzer;
import com.siteaudit.crawl.service.AuditAggregator;
import com.siteaudit.crawl.service.CrawlRunListener;
import com.siteaudit.crawl.service.CrawlRunRegistry;
import com.siteaudit.crawl.service.CrawlScheduler;
import com.siteaudit.crawl.service.PageRecordSink;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

@Configuration
public class CrawlConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getMaxConcurrentFetches() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdownNow")
    public ExecutorService crawlRunExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(properties.getMaxActiveRuns());
    }

    @Bean
    public CrawlScheduler crawlScheduler(
        PageFetcher fetcher,
        PageAnalyzer analyzer,
        AuditAggregator aggregator,
        CrawlRunRegistry registry,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        CrawlerProperties properties,
        ObjectProvider<PageRecordSink> sinks,
        ObjectProvider<CrawlRunListener> listeners
    ) {
        return new CrawlScheduler(
            fetcher,
            analyzer,
            aggregator,
            registry,
            crawlRunExecutor,
            properties,
            sinks.orderedStream().collect(Collectors.toList()),
            listeners.orderedStream().collect(Collectors.toList())
        );
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING);
        return mapper;
    }
}
