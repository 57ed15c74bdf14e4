package io.qzark.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.qzark.Scheduler;
import io.qzark.TaskExecutor;
import io.qzark.TaskStore;
import io.qzark.core.TaskStoreException;
import io.qzark.internal.InMemoryTaskStore;
import io.qzark.internal.PollingScheduler;
import io.qzark.internal.ShellTaskExecutor;
import io.qzark.internal.mongo.MongoTaskStore;
import io.qzark.notify.NotificationFanout;
import io.qzark.tasks.TaskDefinitionLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Spring Boot auto-configuration entrypoint for the task runner.
 */
@AutoConfiguration
@ConditionalOnClass(Scheduler.class)
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "qzark", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QzarkAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(QzarkAutoConfiguration.class);

    static final String DEFAULT_DATABASE = "qzark";

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "qzark")
    public QzarkProperties qzarkProperties() {
        return new QzarkProperties();
    }

    /**
     * Used unless the mongo backend or a user store is present. Validates the bound properties first.
     */
    @Bean
    @ConditionalOnMissingBean(TaskStore.class)
    public TaskStore inMemoryTaskStore(QzarkProperties props) {
        props.validate();
        log.info("Using in-memory task store");
        return new InMemoryTaskStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskExecutor taskExecutor(QzarkProperties props) {
        return new ShellTaskExecutor(props.getCommandTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(name = "qzarkHttpClient")
    public HttpClient qzarkHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationFanout notificationFanout(QzarkProperties props,
                                                 HttpClient qzarkHttpClient,
                                                 ObjectProvider<ObjectMapper> objectMapper) {
        return NotificationFanout.fromProperties(props, qzarkHttpClient, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskDefinitionLoader taskDefinitionLoader() {
        return new TaskDefinitionLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(QzarkProperties props,
                               TaskStore store,
                               TaskExecutor executor,
                               NotificationFanout fanout,
                               TaskDefinitionLoader loader) {
        props.validate();
        log.info("Using timeout: {} seconds", props.getTimeout());
        return new PollingScheduler(props, store, executor, fanout, loader.load(Path.of(props.getTasksFile())));
    }

    @Bean
    @ConditionalOnMissingBean
    public QzarkLifecycle qzarkLifecycle(Scheduler scheduler) {
        return new QzarkLifecycle(scheduler);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "qzark", name = "queue-backend", havingValue = "mongo")
    static class MongoTaskStoreConfiguration {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(name = "qzarkMongoClient")
        public MongoClient qzarkMongoClient(QzarkProperties props) {
            try {
                return MongoClients.create(props.getQueueUrl());
            } catch (IllegalArgumentException e) {
                throw new TaskStoreException("Invalid MongoDB connection URL: " + props.getQueueUrl(), e);
            }
        }

        @Bean
        @ConditionalOnMissingBean(TaskStore.class)
        public TaskStore mongoTaskStore(MongoClient qzarkMongoClient, QzarkProperties props) {
            props.validate();
            MongoTemplate template = new MongoTemplate(qzarkMongoClient, databaseName(props.getQueueUrl()));
            MongoTaskStore store = new MongoTaskStore(template);
            store.verifyConnection();
            if (props.isEnsureIndexesOnStartup()) {
                new QzarkMongoIndexConfig(template).ensureIndexes();
            }
            return store;
        }
    }

    static String databaseName(String url) {
        String db = new ConnectionString(url).getDatabase();
        return (db == null || db.isBlank()) ? DEFAULT_DATABASE : db;
    }
}
