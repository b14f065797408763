package com.example.statements.service;

import java.io.UnsupportedEncodingException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.service.DispatchOutcome.FailureKind;

import jakarta.activation.DataHandler;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;

/**
 * Sends statement and notice emails with PDF attachments via SMTP.
 *
 * <p>When {@code statements.mail.enabled} is false, requests are logged and reported as failed so
 * that no run is recorded as sent without a delivery. SMTP connect, read and write timeouts are
 * bounded by {@code statements.dispatch.send-timeout}.
 */
@Service
public class StatementMailer {

  private static final Logger log = LoggerFactory.getLogger(StatementMailer.class);

  private final StatementsProperties properties;
  private final RetryClassifier retryClassifier;
  private final JavaMailSender mailSender;

  @Autowired
  public StatementMailer(
      StatementsProperties properties,
      RetryClassifier retryClassifier,
      @Autowired(required = false) JavaMailSender mailSender) {
    this.properties = properties;
    this.retryClassifier = retryClassifier;
    this.mailSender = mailSender;
    applySendTimeout();
  }

  /** Result of a send attempt. */
  public record MailResult(
      boolean success, String status, String message, FailureKind failureKind) {
    public static MailResult sent() {
      return new MailResult(true, "SENT", "Email sent successfully", null);
    }

    public static MailResult disabled() {
      return new MailResult(
          false, "DISABLED", "Email sending is not enabled", FailureKind.PERMANENT);
    }

    public static MailResult notConfigured() {
      return new MailResult(
          false, "NOT_CONFIGURED", "SMTP is not configured", FailureKind.PERMANENT);
    }

    public static MailResult invalidRecipient(String reason) {
      return new MailResult(false, "INVALID_RECIPIENT", reason, FailureKind.PERMANENT);
    }

    public static MailResult failed(FailureKind kind, String reason) {
      return new MailResult(false, "FAILED", reason, kind);
    }
  }

  /** Outgoing message. */
  public record MailRequest(
      List<String> to,
      List<String> cc,
      String subject,
      String bodyText,
      List<MailAttachment> attachments) {
    public static Builder builder() {
      return new Builder();
    }

    public static class Builder {
      private final List<String> to = new ArrayList<>();
      private final List<String> cc = new ArrayList<>();
      private String subject;
      private String bodyText;
      private List<MailAttachment> attachments = List.of();

      public Builder to(List<String> addresses) {
        this.to.addAll(addresses);
        return this;
      }

      public Builder cc(String address) {
        if (address != null && !address.isBlank()) {
          this.cc.add(address.trim());
        }
        return this;
      }

      public Builder subject(String subject) {
        this.subject = subject;
        return this;
      }

      public Builder bodyText(String text) {
        this.bodyText = text;
        return this;
      }

      public Builder attachments(List<MailAttachment> attachments) {
        this.attachments = attachments != null ? attachments : List.of();
        return this;
      }

      public MailRequest build() {
        return new MailRequest(List.copyOf(to), List.copyOf(cc), subject, bodyText, attachments);
      }
    }
  }

  /** Attachment bytes with display name. */
  public record MailAttachment(String filename, String mimeType, byte[] content) {
    public static MailAttachment pdf(String filename, byte[] content) {
      return new MailAttachment(filename, "application/pdf", content);
    }
  }

  public MailResult send(MailRequest request) {
    if (request.to() == null || request.to().isEmpty()) {
      return MailResult.invalidRecipient("At least one recipient address is required");
    }
    for (String address : request.to()) {
      if (!isValidEmail(address)) {
        return MailResult.invalidRecipient("Invalid email address: " + address);
      }
    }
    if (request.subject() == null || request.subject().isBlank()) {
      return MailResult.failed(FailureKind.PERMANENT, "Email subject is required");
    }

    if (!properties.getMail().isEnabled()) {
      log.info(
          "Email sending disabled. Would send to: {} subject: {}", request.to(), request.subject());
      return MailResult.disabled();
    }

    if (mailSender == null) {
      log.warn(
          "Email enabled but JavaMailSender not configured. Would send to: {} subject: {}",
          request.to(),
          request.subject());
      return MailResult.notConfigured();
    }

    MimeMessage mimeMessage;
    try {
      mimeMessage = compose(request);
    } catch (MessagingException | UnsupportedEncodingException e) {
      log.error("Failed to compose email to {}: {}", request.to(), e.getMessage(), e);
      return MailResult.failed(
          FailureKind.PERMANENT, "Failed to compose email: " + e.getMessage());
    }

    try {
      mailSender.send(mimeMessage);
    } catch (MailException e) {
      FailureKind kind = retryClassifier.classify(e);
      log.error(
          "Failed to send email to {} ({}): {}", request.to(), kind, RetryClassifier.describe(e));
      return MailResult.failed(kind, "Failed to send email: " + RetryClassifier.describe(e));
    }

    log.info(
        "Email sent: to={}, cc={}, subject={}, attachments={}",
        request.to(),
        request.cc(),
        request.subject(),
        request.attachments().size());
    return MailResult.sent();
  }

  private MimeMessage compose(MailRequest request)
      throws MessagingException, UnsupportedEncodingException {
    MimeMessage mimeMessage = mailSender.createMimeMessage();
    StatementsProperties.Mail mail = properties.getMail();

    mimeMessage.setFrom(new InternetAddress(mail.getFromAddress(), mail.getFromName()));
    mimeMessage.setRecipients(MimeMessage.RecipientType.TO, toAddresses(request.to()));
    if (!request.cc().isEmpty()) {
      mimeMessage.setRecipients(MimeMessage.RecipientType.CC, toAddresses(request.cc()));
    }
    mimeMessage.setSubject(request.subject(), "UTF-8");

    String body = request.bodyText() != null ? request.bodyText() : "";
    if (request.attachments().isEmpty()) {
      mimeMessage.setText(body, "UTF-8");
      return mimeMessage;
    }

    MimeMultipart multipart = new MimeMultipart();
    MimeBodyPart textPart = new MimeBodyPart();
    textPart.setText(body, "UTF-8");
    multipart.addBodyPart(textPart);

    for (MailAttachment attachment : request.attachments()) {
      MimeBodyPart attachmentPart = new MimeBodyPart();
      ByteArrayDataSource dataSource =
          new ByteArrayDataSource(attachment.content(), attachment.mimeType());
      attachmentPart.setDataHandler(new DataHandler(dataSource));
      attachmentPart.setFileName(attachment.filename());
      multipart.addBodyPart(attachmentPart);
    }
    mimeMessage.setContent(multipart);
    return mimeMessage;
  }

  private InternetAddress[] toAddresses(List<String> addresses) throws MessagingException {
    InternetAddress[] result = new InternetAddress[addresses.size()];
    for (int i = 0; i < addresses.size(); i++) {
      result[i] = new InternetAddress(addresses.get(i).trim(), true);
    }
    return result;
  }

  /** Explicit spring.mail.properties.* values win over the configured send timeout. */
  private void applySendTimeout() {
    if (!(mailSender instanceof JavaMailSenderImpl impl)) {
      return;
    }
    Duration timeout = properties.getDispatch().getSendTimeout();
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return;
    }
    String millis = String.valueOf(timeout.toMillis());
    Properties javaMail = impl.getJavaMailProperties();
    javaMail.putIfAbsent("mail.smtp.connectiontimeout", millis);
    javaMail.putIfAbsent("mail.smtp.timeout", millis);
    javaMail.putIfAbsent("mail.smtp.writetimeout", millis);
  }

  /** Basic email validation. */
  static boolean isValidEmail(String email) {
    if (email == null || email.isBlank()) {
      return false;
    }
    return email.trim().matches("^[A-Za-z0-9+_.-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
  }
}
