package com.example.statements.service;

import com.example.statements.service.DispatchOutcome.FailureKind;
import jakarta.mail.internet.AddressException;
import org.junit.jupiter.api.Test;
import org.springframework.mail.MailSendException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryClassifier.
 */
class RetryClassifierTest {

    private final RetryClassifier classifier = new RetryClassifier();

    @Test
    void classify_NetworkCause_Transient() {
        MailSendException error = new MailSendException("Mail server connection failed",
            new ConnectException("Connection refused"));

        assertEquals(FailureKind.TRANSIENT, classifier.classify(error));
    }

    @Test
    void classify_ConnectionReset_Transient() {
        assertEquals(FailureKind.TRANSIENT, classifier.classify(new SocketException("Connection reset")));
    }

    @Test
    void classify_MalformedAddress_Permanent() {
        MailSendException error = new MailSendException("Failed messages",
            new AddressException("Missing final '@domain'"));

        assertEquals(FailureKind.PERMANENT, classifier.classify(error));
    }

    @Test
    void classify_SmtpReplyCodes_ByMessage() {
        assertEquals(FailureKind.TRANSIENT, classifier.classify(new MailSendException("451 4.3.0 Try again later")));
        assertEquals(FailureKind.PERMANENT, classifier.classify(new MailSendException("550 5.1.1 User unknown")));
    }

    @Test
    void classify_UnrecognisedError_Unknown() {
        assertEquals(FailureKind.UNKNOWN, classifier.classify(new IOException("disk quota exceeded")));
    }

    @Test
    void isRetryable_ByOutcome() {
        assertTrue(classifier.isRetryable(DispatchOutcome.failed(FailureKind.TRANSIENT, "x")));
        assertFalse(classifier.isRetryable(DispatchOutcome.failed(FailureKind.PERMANENT, "Connection timed out")));
        assertTrue(classifier.isRetryable(DispatchOutcome.failed(FailureKind.UNKNOWN, "Read timed out")));
        assertFalse(classifier.isRetryable(DispatchOutcome.failed(FailureKind.UNKNOWN, "no such mailbox")));
        assertFalse(classifier.isRetryable(DispatchOutcome.sent("/out/a.pdf")));
    }

    @Test
    void describe_JoinsCauseChain() {
        Exception error = new IllegalStateException("send failed", new SocketException("Broken pipe"));

        assertEquals("send failed: Broken pipe", RetryClassifier.describe(error));
    }
}
