package io.qzark.config;

import io.qzark.Scheduler;
import io.qzark.TaskExecutor;
import io.qzark.TaskStore;
import io.qzark.internal.InMemoryTaskStore;
import io.qzark.internal.PollingScheduler;
import io.qzark.internal.ShellTaskExecutor;
import io.qzark.notify.NotificationChannel;
import io.qzark.notify.NotificationFanout;
import io.qzark.notify.TelegramChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class QzarkAutoConfigurationTest {

    @TempDir
    Path dir;

    private ApplicationContextRunner contextRunner;

    @BeforeEach
    void setUp() throws Exception {
        Path tasks = Files.writeString(dir.resolve("tasks.yaml"), String.join("\n",
                "tasks:",
                "  - name: hello",
                "    interval_seconds: 3600",
                "    shell_command: \"true\"",
                ""));

        contextRunner = new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(QzarkAutoConfiguration.class))
                .withPropertyValues(
                        "qzark.tasks-file=" + tasks,
                        "qzark.poll-pause=1h",
                        "qzark.command-timeout=5s"
                );
    }

    @Test
    void shouldAutoConfigureInMemoryRunner() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Scheduler.class);
            assertThat(context).hasSingleBean(QzarkLifecycle.class);
            assertThat(context).hasSingleBean(QzarkProperties.class);
            assertThat(context).getBean(TaskStore.class).isInstanceOf(InMemoryTaskStore.class);
            assertThat(context).getBean(TaskExecutor.class).isInstanceOf(ShellTaskExecutor.class);

            ShellTaskExecutor executor = context.getBean(ShellTaskExecutor.class);
            assertThat(executor.getTimeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(context.getBean(QzarkProperties.class).getPollPause()).isEqualTo(Duration.ofHours(1));
            assertThat(context.getBean(Scheduler.class).isRunning()).isTrue();
            assertThat(context.getBean(NotificationFanout.class).getChannels()).isEmpty();
        });
    }

    @Test
    void tasksFromFileShouldBeSeededIntoStore() {
        contextRunner.run(context -> {
            TaskStore store = context.getBean(TaskStore.class);
            PollingScheduler scheduler = (PollingScheduler) context.getBean(Scheduler.class);

            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while ((scheduler.lastRuns().isEmpty() || !store.contains("hello")) && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(scheduler.lastRuns()).containsKey("hello");
            assertThat(store.contains("hello")).isTrue();
        });
    }

    @Test
    void missingTasksFileShouldStillStart() {
        contextRunner
                .withPropertyValues("qzark.tasks-file=" + dir.resolve("absent.yaml"))
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(TaskStore.class).snapshot()).isEmpty();
                });
    }

    @Test
    void notificationAndPollingSettingsShouldBeBound() {
        contextRunner
                .withPropertyValues(
                        "qzark.timeout=120",
                        "qzark.max-concurrency=3",
                        "qzark.notification.smtp.server=smtp.example.com",
                        "qzark.notification.smtp.port=587",
                        "qzark.notification.discord.webhook-url=https://discord.example/hook"
                )
                .run(context -> {
                    QzarkProperties props = context.getBean(QzarkProperties.class);
                    assertThat(props.getTimeout()).isEqualTo(120);
                    assertThat(props.getMaxConcurrency()).isEqualTo(3);
                    assertThat(props.getNotification().getSmtp().getPort()).isEqualTo(587);
                    assertThat(props.getNotification().getDiscord().isEnabled()).isTrue();
                });
    }

    @Test
    void disabledPropertyShouldSkipEverything() {
        contextRunner
                .withPropertyValues("qzark.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Scheduler.class);
                    assertThat(context).doesNotHaveBean(QzarkProperties.class);
                });
    }

    @Test
    void telegramSettingsShouldEnableTelegramChannel() {
        contextRunner
                .withPropertyValues(
                        "qzark.notification.telegram.bot-token=123:abc",
                        "qzark.notification.telegram.chat-id=42"
                )
                .run(context -> assertThat(context.getBean(NotificationFanout.class).getChannels())
                        .extracting(NotificationChannel::name)
                        .containsExactly(TelegramChannel.NAME));
    }

    @Test
    void userTaskStoreShouldWin() {
        InMemoryTaskStore custom = new InMemoryTaskStore();
        contextRunner
                .withBean(TaskStore.class, () -> custom)
                .run(context -> assertThat(context.getBean(TaskStore.class)).isSameAs(custom));
    }

    @Test
    void outOfRangeTimeoutShouldFailStartup() {
        contextRunner
                .withPropertyValues("qzark.timeout=5")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure()
                        .hasStackTraceContaining("qzark.timeout must be between 10 and 300 seconds"));
    }

    @Test
    void unknownBackendShouldFailStartup() {
        contextRunner
                .withPropertyValues("qzark.queue-backend=redis")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure()
                        .hasStackTraceContaining("qzark.queue-backend must be 'memory' or 'mongo': redis"));
    }

    @Test
    void databaseNameShouldComeFromUrl() {
        assertThat(QzarkAutoConfiguration.databaseName("mongodb://localhost:27017/jobs")).isEqualTo("jobs");
        assertThat(QzarkAutoConfiguration.databaseName("mongodb://localhost:27017")).isEqualTo("qzark");
    }
}
