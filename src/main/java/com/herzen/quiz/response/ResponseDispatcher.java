package com.herzen.quiz.response;

import com.herzen.quiz.config.QuizProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class ResponseDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ResponseDispatcher.class);

    private final ResponseSender sender;
    private final ExecutorService[] workers;

    public ResponseDispatcher(ResponseSender sender, QuizProperties properties) {
        this.sender = sender;
        QuizProperties.Delivery delivery = properties.delivery();
        if ("async".equalsIgnoreCase(delivery.mode())) {
            int count = Math.max(1, delivery.workers());
            ThreadFactory threads = new ThreadFactory() {
                private final AtomicInteger idx = new AtomicInteger(1);

                @Override
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, "quiz-delivery-" + idx.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                }
            };
            this.workers = new ExecutorService[count];
            for (int i = 0; i < count; i++) {
                workers[i] = Executors.newSingleThreadExecutor(threads);
            }
        } else {
            this.workers = new ExecutorService[0];
        }
    }

    // async: one single-thread worker per player hash keeps a player's responses in order
    public void dispatch(List<Response> responses) {
        if (responses.isEmpty()) return;
        if (workers.length == 0) {
            responses.forEach(sender::send);
            return;
        }
        ExecutorService worker = workers[Math.floorMod(responses.get(0).to().hashCode(), workers.length)];
        worker.execute(() -> responses.forEach(this::deliverQuietly));
    }

    public boolean isAsync() {
        return workers.length > 0;
    }

    private void deliverQuietly(Response response) {
        try {
            sender.send(response);
        } catch (RuntimeException e) {
            log.error("Failed to deliver {} to {}", response.message().type(), response.to(), e);
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        for (ExecutorService worker : workers) {
            worker.shutdown();
        }
        for (ExecutorService worker : workers) {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Delivery worker did not finish in time, dropping queued responses");
                worker.shutdownNow();
            }
        }
    }
}
