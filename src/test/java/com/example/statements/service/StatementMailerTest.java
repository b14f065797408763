package com.example.statements.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import com.example.statements.config.StatementsProperties;
import com.example.statements.service.DispatchOutcome.FailureKind;
import com.example.statements.service.StatementMailer.MailAttachment;
import com.example.statements.service.StatementMailer.MailRequest;
import com.example.statements.service.StatementMailer.MailResult;

import jakarta.mail.Multipart;
import jakarta.mail.internet.MimeMessage;

/**
 * Unit tests for StatementMailer. Tests address validation, disabled and unconfigured modes, SMTP
 * sending and failure classification.
 */
@ExtendWith(MockitoExtension.class)
class StatementMailerTest {

  @Mock private JavaMailSender mailSender;
  @Mock private MimeMessage mimeMessage;

  private StatementsProperties properties;
  private StatementMailer mailer;

  @BeforeEach
  void setUp() {
    properties = new StatementsProperties();
    properties.getMail().setEnabled(true);
    properties.getMail().setFromAddress("statements@test.local");
    properties.getMail().setFromName("Test Foods");

    mailer = new StatementMailer(properties, new RetryClassifier(), mailSender);
  }

  @Test
  void send_ValidRequest_WhenDisabled_ReturnsPermanentDisabled() {
    // Given
    properties.getMail().setEnabled(false);

    // When
    MailResult result = mailer.send(request("ap@acme.example"));

    // Then
    assertFalse(result.success());
    assertEquals("DISABLED", result.status());
    assertEquals(FailureKind.PERMANENT, result.failureKind());
    verifyNoInteractions(mailSender);
  }

  @Test
  void send_NoMailSender_ReturnsNotConfigured() {
    // Given
    StatementMailer unconfigured = new StatementMailer(properties, new RetryClassifier(), null);

    // When
    MailResult result = unconfigured.send(request("ap@acme.example"));

    // Then
    assertFalse(result.success());
    assertEquals("NOT_CONFIGURED", result.status());
  }

  @Test
  void send_InvalidAddress_ReturnsInvalidRecipient() {
    // When
    MailResult result = mailer.send(request("not-an-address"));

    // Then
    assertFalse(result.success());
    assertEquals("INVALID_RECIPIENT", result.status());
    assertEquals(FailureKind.PERMANENT, result.failureKind());
    verifyNoInteractions(mailSender);
  }

  @Test
  void send_NoRecipients_ReturnsInvalidRecipient() {
    // Given
    MailRequest request = MailRequest.builder().to(List.of()).subject("Statement").build();

    // When
    MailResult result = mailer.send(request);

    // Then
    assertEquals("INVALID_RECIPIENT", result.status());
  }

  @Test
  void send_WithAttachment_SendsMultipartMessage() throws Exception {
    // Given
    when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
    MailRequest request =
        MailRequest.builder()
            .to(List.of("ap@acme.example", "owner@acme.example"))
            .cc("collections@test.local")
            .subject("Statement of Open Invoices 03/04/2024")
            .bodyText("Dear Customer,")
            .attachments(List.of(MailAttachment.pdf("Acme_Statement_20240304.pdf", new byte[] {1, 2})))
            .build();

    // When
    MailResult result = mailer.send(request);

    // Then
    assertTrue(result.success());
    assertEquals("SENT", result.status());
    verify(mailSender).send(mimeMessage);
    verify(mimeMessage).setSubject("Statement of Open Invoices 03/04/2024", "UTF-8");
    verify(mimeMessage).setRecipients(eq(MimeMessage.RecipientType.CC), any(jakarta.mail.Address[].class));
    verify(mimeMessage).setContent(any(Multipart.class));
  }

  @Test
  void send_SmtpTimeout_ReturnsTransientFailure() {
    // Given
    when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
    doThrow(new MailSendException("Mail server connection failed", new SocketTimeoutException("Read timed out")))
        .when(mailSender)
        .send(any(MimeMessage.class));

    // When
    MailResult result = mailer.send(request("ap@acme.example"));

    // Then
    assertFalse(result.success());
    assertEquals("FAILED", result.status());
    assertEquals(FailureKind.TRANSIENT, result.failureKind());
    assertTrue(result.message().contains("Read timed out"));
  }

  @Test
  void send_AuthenticationRejected_ReturnsPermanentFailure() {
    // Given
    when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
    doThrow(new MailAuthenticationException("535 Authentication failed"))
        .when(mailSender)
        .send(any(MimeMessage.class));

    // When
    MailResult result = mailer.send(request("ap@acme.example"));

    // Then
    assertEquals(FailureKind.PERMANENT, result.failureKind());
  }

  @Test
  void constructor_JavaMailSenderImpl_AppliesSendTimeoutUnlessSet() {
    // Given
    properties.getDispatch().setSendTimeout(Duration.ofSeconds(20));
    JavaMailSenderImpl impl = new JavaMailSenderImpl();
    impl.getJavaMailProperties().setProperty("mail.smtp.timeout", "5000");

    // When
    new StatementMailer(properties, new RetryClassifier(), impl);

    // Then
    assertEquals("20000", impl.getJavaMailProperties().getProperty("mail.smtp.connectiontimeout"));
    assertEquals("5000", impl.getJavaMailProperties().getProperty("mail.smtp.timeout"));
    assertEquals("20000", impl.getJavaMailProperties().getProperty("mail.smtp.writetimeout"));
  }

  @Test
  void isValidEmail_VariousInputs() {
    assertTrue(StatementMailer.isValidEmail("ap@acme.example"));
    assertTrue(StatementMailer.isValidEmail(" first.last+ar@sub.acme.com "));
    assertFalse(StatementMailer.isValidEmail("acme.example"));
    assertFalse(StatementMailer.isValidEmail("ap@acme"));
    assertFalse(StatementMailer.isValidEmail(""));
    assertFalse(StatementMailer.isValidEmail(null));
  }

  // Helper methods

  private MailRequest request(String to) {
    return MailRequest.builder()
        .to(List.of(to))
        .subject("Statement of Open Invoices 03/04/2024")
        .bodyText("Dear Customer,")
        .build();
  }
}
