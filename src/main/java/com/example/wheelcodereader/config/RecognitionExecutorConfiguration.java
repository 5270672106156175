package com.example.wheelcodereader.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecognitionExecutorConfiguration {

    /**
     * Worker pool running per-image OCR of a multi-angle batch.
     */
    @Bean(name = "recognitionExecutor", destroyMethod = "shutdown")
    public ExecutorService recognitionExecutor(WheelRecognitionProperties properties) {
        int workers = Math.max(1, properties.getSystem().getNumWorkers());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "wheel-ocr-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
