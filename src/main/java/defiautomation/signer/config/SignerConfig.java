package defiautomation.signer.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import defiautomation.signer.service.signing.SignerFactory;
import defiautomation.signer.service.signing.SigningBackend;
import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class SignerConfig {

    private static final int SIGNING_QUEUE_CAPACITY = 256;

    @Bean
    public SigningBackend signingBackend(SignerFactory signerFactory) {
        SigningBackend backend = signerFactory.create();
        backend.validateConfig();
        log.info("Signing backend initialized: {}", backend.provider().getWireValue());
        return backend;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "signingExecutor", destroyMethod = "shutdown")
    public ExecutorService signingExecutor(SignerProperties properties) {
        int threads = Math.max(1, properties.getSigningThreads());
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(SIGNING_QUEUE_CAPACITY),
            runnable -> {
                Thread thread = new Thread(runnable, "signer-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            },
            new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
