package com.example.statements.service;

import com.example.statements.service.DispatchOutcome.FailureKind;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.AddressException;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Classifies delivery failures as transient or permanent.
 *
 * <p>Exception types are checked first. When the type says nothing useful the message text
 * is matched against known transient patterns: timeouts, refused or reset connections and
 * SMTP 4xx replies.
 */
@Component
public class RetryClassifier {

    private static final Pattern TRANSIENT_TEXT = Pattern.compile(
        "(?i)(timed?\\s*out|timeout|connection (reset|refused|closed|aborted)|broken pipe"
            + "|temporar(y|ily)|try again|too many connections|service not available"
            + "|\\b(421|450|451|452|454)\\b|\\b4\\.\\d\\.\\d{1,3}\\b)");

    private static final Pattern PERMANENT_SMTP = Pattern.compile("\\b5\\d\\d\\b|\\b5\\.\\d\\.\\d{1,3}\\b");

    /**
     * Kind of a failure raised while sending. Walks the cause chain.
     */
    public FailureKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof SocketTimeoutException
                    || t instanceof ConnectException
                    || t instanceof UnknownHostException) {
                return FailureKind.TRANSIENT;
            }
            if (t instanceof SocketException && t.getMessage() != null
                    && t.getMessage().toLowerCase().contains("reset")) {
                return FailureKind.TRANSIENT;
            }
            if (t instanceof MailAuthenticationException
                    || t instanceof AuthenticationFailedException
                    || t instanceof AddressException
                    || t instanceof MailParseException
                    || t instanceof MailPreparationException) {
                return FailureKind.PERMANENT;
            }
            if (t instanceof SendFailedException sendFailed
                    && sendFailed.getInvalidAddresses() != null
                    && sendFailed.getInvalidAddresses().length > 0) {
                return FailureKind.PERMANENT;
            }
        }
        String message = describe(error);
        if (TRANSIENT_TEXT.matcher(message).find()) {
            return FailureKind.TRANSIENT;
        }
        if (PERMANENT_SMTP.matcher(message).find()) {
            return FailureKind.PERMANENT;
        }
        return FailureKind.UNKNOWN;
    }

    public boolean isRetryable(DispatchOutcome outcome) {
        if (!outcome.isFailed()) {
            return false;
        }
        FailureKind kind = outcome.failureKind() != null ? outcome.failureKind() : FailureKind.UNKNOWN;
        return switch (kind) {
            case TRANSIENT -> true;
            case PERMANENT -> false;
            case UNKNOWN -> looksTransient(outcome.message());
        };
    }

    public boolean looksTransient(String message) {
        return message != null && TRANSIENT_TEXT.matcher(message).find();
    }

    /**
     * Messages of the whole cause chain, for logging and pattern matching.
     */
    public static String describe(Throwable error) {
        StringBuilder text = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (text.length() > 0) {
                text.append(": ");
            }
            text.append(t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
        }
        return text.toString();
    }
}
