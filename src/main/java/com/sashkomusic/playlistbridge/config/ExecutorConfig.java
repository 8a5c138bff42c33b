package com.sashkomusic.playlistbridge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService importJobExecutor() {
        log.info("Creating import job executor");
        return Executors.newCachedThreadPool(namedThreads("import-job-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService matchingExecutor(PlaylistTransferConfig config) {
        int concurrency = Math.max(1, config.getMatching().getConcurrency());
        log.info("Creating song matching executor with {} threads", concurrency * 2);
        return Executors.newFixedThreadPool(concurrency * 2, namedThreads("song-match-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
