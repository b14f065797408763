package com.example.statements.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for statement aging and dispatch.
 */
@ConfigurationProperties(prefix = "statements")
public class StatementsProperties {

    /**
     * Directory rendered statement PDFs are written to.
     */
    private String outputDir = "./data/out";

    private final Dispatch dispatch = new Dispatch();
    private final Invoices invoices = new Invoices();
    private final Mail mail = new Mail();
    private final Company company = new Company();

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Invoices getInvoices() {
        return invoices;
    }

    public Mail getMail() {
        return mail;
    }

    public Company getCompany() {
        return company;
    }

    public static class Dispatch {
        /**
         * Whether the background worker is started with the application.
         */
        private boolean enabled = true;
        /**
         * Cron expression of the scheduled enqueue tick.
         */
        private String cron = "0 0 7 * * *";
        /**
         * Retries after the first attempt for transient send failures.
         */
        private int retries = 2;
        /**
         * Base retry delay, multiplied by the attempt number.
         */
        private Duration retryBackoff = Duration.ofSeconds(5);
        /**
         * Pause between consecutive items of a job.
         */
        private Duration itemDelay = Duration.ZERO;
        /**
         * Worker sleep when no job is queued.
         */
        private Duration idleDelay = Duration.ofSeconds(10);
        /**
         * Worker sleep after an unexpected error in the loop.
         */
        private Duration errorDelay = Duration.ofSeconds(5);
        /**
         * A running job whose heartbeat is older than this is requeued.
         */
        private Duration staleAfter = Duration.ofMinutes(10);
        /**
         * Upper bound on recipients per job, 0 for no limit.
         */
        private int maxRecipients = 0;
        /**
         * SMTP connect, read and write timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getItemDelay() {
            return itemDelay;
        }

        public void setItemDelay(Duration itemDelay) {
            this.itemDelay = itemDelay;
        }

        public Duration getIdleDelay() {
            return idleDelay;
        }

        public void setIdleDelay(Duration idleDelay) {
            this.idleDelay = idleDelay;
        }

        public Duration getErrorDelay() {
            return errorDelay;
        }

        public void setErrorDelay(Duration errorDelay) {
            this.errorDelay = errorDelay;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public int getMaxRecipients() {
            return maxRecipients;
        }

        public void setMaxRecipients(int maxRecipients) {
            this.maxRecipients = maxRecipients;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    public static class Invoices {
        /**
         * Where dispatch and reports read invoices from: the latest upload, or a fixed path.
         */
        private Source source = Source.LATEST_UPLOAD;
        /**
         * Fixed invoice export path, used when source is PATH.
         */
        private String path;
        /**
         * Directory uploaded invoice exports are stored in.
         */
        private String uploadDir = "./data/uploads";

        public Source getSource() {
            return source;
        }

        public void setSource(Source source) {
            this.source = source;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getUploadDir() {
            return uploadDir;
        }

        public void setUploadDir(String uploadDir) {
            this.uploadDir = uploadDir;
        }

        public enum Source {
            LATEST_UPLOAD,
            PATH
        }
    }

    public static class Mail {
        private boolean enabled = false;
        private String fromAddress = "statements@example.com";
        private String fromName = "Accounts Receivable";
        /**
         * Copied on overdue notices, empty for none.
         */
        private String noticeCc;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFromAddress() {
            return fromAddress;
        }

        public void setFromAddress(String fromAddress) {
            this.fromAddress = fromAddress;
        }

        public String getFromName() {
            return fromName;
        }

        public void setFromName(String fromName) {
            this.fromName = fromName;
        }

        public String getNoticeCc() {
            return noticeCc;
        }

        public void setNoticeCc(String noticeCc) {
            this.noticeCc = noticeCc;
        }
    }

    public static class Company {
        private String name = "Accounts Receivable";
        private String subtitle = "Statement of Outstanding Invoices";
        private String address;
        private String phone;
        private String email;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSubtitle() {
            return subtitle;
        }

        public void setSubtitle(String subtitle) {
            this.subtitle = subtitle;
        }

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getPhone() {
            return phone;
        }

        public void setPhone(String phone) {
            this.phone = phone;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }
    }
}
