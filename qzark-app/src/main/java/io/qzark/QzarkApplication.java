package io.qzark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point.
 *
 * <p>Configuration comes from {@code application.yml}, the environment and {@code --qzark.*=}
 * arguments, e.g. {@code --qzark.queue-backend=mongo --qzark.queue-url=mongodb://mongo:27017/qzark
 * --logging.level.io.qzark=DEBUG}. Runs until the process is interrupted.
 */
@SpringBootApplication(exclude = {MongoAutoConfiguration.class, MongoDataAutoConfiguration.class})
public class QzarkApplication {
    private static final Logger log = LoggerFactory.getLogger(QzarkApplication.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("Starting Qzark application (queue-based tasks in YAML).");

        SpringApplication app = new SpringApplication(QzarkApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setRegisterShutdownHook(true);
        app.run(args);

        CountDownLatch keepAlive = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, stopping scheduler...");
            keepAlive.countDown();
        }, "qzark.shutdown"));
        keepAlive.await();
    }
}
