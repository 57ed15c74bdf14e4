package io.qzark.notify;

import io.qzark.config.QzarkProperties;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.Objects;
import java.util.Properties;

/**
 * Sends plain-text notification mails over SMTP with STARTTLS.
 * Authenticates only when both username and password are configured.
 */
public class SmtpChannel implements NotificationChannel {

    public static final String NAME = "SMTP";
    public static final String SUBJECT = "Qzark Task Failure Notification";

    private final QzarkProperties.Smtp config;
    private final Session session;

    public SmtpChannel(QzarkProperties.Smtp config, Duration timeout) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.session = Session.getInstance(sessionProperties(config, timeout));
    }

    static Properties sessionProperties(QzarkProperties.Smtp config, Duration timeout) {
        String millis = String.valueOf(timeout.toMillis());
        Properties props = new Properties();
        props.put("mail.smtp.host", config.getServer());
        props.put("mail.smtp.port", String.valueOf(config.getPort()));
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.starttls.required", "true");
        props.put("mail.smtp.auth", String.valueOf(config.hasCredentials()));
        props.put("mail.smtp.connectiontimeout", millis);
        props.put("mail.smtp.timeout", millis);
        props.put("mail.smtp.writetimeout", millis);
        return props;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(String message) throws MessagingException {
        MimeMessage mail = buildMessage(message);
        if (config.hasCredentials()) {
            Transport.send(mail, config.getUsername(), config.getPassword());
        } else {
            Transport.send(mail);
        }
    }

    MimeMessage buildMessage(String message) throws MessagingException {
        MimeMessage mail = new MimeMessage(session);
        mail.setFrom(new InternetAddress(config.getFrom()));
        mail.setRecipients(Message.RecipientType.TO, InternetAddress.parse(config.getTo()));
        mail.setSubject(SUBJECT, StandardCharsets.UTF_8.name());
        mail.setText(message, StandardCharsets.UTF_8.name());
        mail.setSentDate(new Date());
        return mail;
    }

    Session getSession() {
        return session;
    }
}
