package io.qzark.config;

import java.time.Duration;

/**
 * Runtime configuration for the task runner.
 *
 * <p>Built once at startup (bound from {@code qzark.*} properties by the starter) and handed to the
 * scheduler, executor and notification fanout through their constructors.
 */
public class QzarkProperties {

    public static final String BACKEND_MEMORY = "memory";
    public static final String BACKEND_MONGO = "mongo";

    private int timeout = 50; // seconds, global, 10..300
    private Duration pollPause = Duration.ofSeconds(1);
    private Duration commandTimeout = Duration.ofSeconds(300);
    private int maxConcurrency = 1;
    private String queueBackend = BACKEND_MEMORY;
    private String queueUrl = "mongodb://localhost:27017/qzark";
    private String tasksFile = "tasks.yaml";
    private boolean ensureIndexesOnStartup = true;
    private final Notification notification = new Notification();

    /**
     * Rejects values outside their documented ranges.
     */
    public void validate() {
        if (timeout < 10 || timeout > 300) {
            throw new IllegalArgumentException("qzark.timeout must be between 10 and 300 seconds: " + timeout);
        }
        if (pollPause == null || pollPause.isNegative()) {
            throw new IllegalArgumentException("qzark.poll-pause must not be negative");
        }
        if (commandTimeout == null || commandTimeout.isZero() || commandTimeout.isNegative()) {
            throw new IllegalArgumentException("qzark.command-timeout must be a positive duration");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("qzark.max-concurrency must be a positive number");
        }
        if (!BACKEND_MEMORY.equals(queueBackend) && !BACKEND_MONGO.equals(queueBackend)) {
            throw new IllegalArgumentException("qzark.queue-backend must be 'memory' or 'mongo': " + queueBackend);
        }
        if (BACKEND_MONGO.equals(queueBackend) && (queueUrl == null || queueUrl.isBlank())) {
            throw new IllegalArgumentException("qzark.queue-url is required for the mongo backend");
        }
    }

    public int getTimeout() {
        return timeout;
    }

    public Duration timeoutDuration() {
        return Duration.ofSeconds(timeout);
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public Duration getPollPause() {
        return pollPause;
    }

    public void setPollPause(Duration pollPause) {
        this.pollPause = pollPause;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public String getQueueBackend() {
        return queueBackend;
    }

    public void setQueueBackend(String queueBackend) {
        this.queueBackend = queueBackend;
    }

    public String getQueueUrl() {
        return queueUrl;
    }

    public void setQueueUrl(String queueUrl) {
        this.queueUrl = queueUrl;
    }

    public String getTasksFile() {
        return tasksFile;
    }

    public void setTasksFile(String tasksFile) {
        this.tasksFile = tasksFile;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Notification getNotification() {
        return notification;
    }

    public static class Notification {
        private final Telegram telegram = new Telegram();
        private final Discord discord = new Discord();
        private final Smtp smtp = new Smtp();

        public Telegram getTelegram() {
            return telegram;
        }

        public Discord getDiscord() {
            return discord;
        }

        public Smtp getSmtp() {
            return smtp;
        }
    }

    public static class Telegram {
        private String botToken;
        private String chatId;
        private String apiUrl = "https://api.telegram.org";

        public boolean isEnabled() {
            return hasText(botToken) && hasText(chatId);
        }

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public String getChatId() {
            return chatId;
        }

        public void setChatId(String chatId) {
            this.chatId = chatId;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }
    }

    public static class Discord {
        private String webhookUrl;

        public boolean isEnabled() {
            return hasText(webhookUrl);
        }

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }
    }

    public static class Smtp {
        private String server;
        private int port = 25;
        private String username;
        private String password;
        private String from;
        private String to;

        public boolean isEnabled() {
            return hasText(server) && hasText(from) && hasText(to);
        }

        public boolean hasCredentials() {
            return hasText(username) && hasText(password);
        }

        public String getServer() {
            return server;
        }

        public void setServer(String server) {
            this.server = server;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
