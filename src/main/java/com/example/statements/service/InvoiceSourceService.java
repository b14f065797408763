package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.config.StatementsProperties.Invoices.Source;
import com.example.statements.domain.InvoiceFile;
import com.example.statements.repository.InvoiceFileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Locates the invoice export that dispatch and reports work from, and registers uploads.
 *
 * <p>Snapshots are identified by a reference string persisted on jobs and runs:
 * {@code file:<id>} for a registered upload, {@code path:<absolute path>} for a fixed file.
 */
@Service
public class InvoiceSourceService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceSourceService.class);

    static final String FILE_PREFIX = "file:";
    static final String PATH_PREFIX = "path:";

    private static final DateTimeFormatter UPLOAD_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final InvoiceFileRepository invoiceFileRepository;
    private final InvoiceFileReader invoiceFileReader;
    private final StatementsProperties properties;
    private final Clock clock;

    public InvoiceSourceService(InvoiceFileRepository invoiceFileRepository,
                                InvoiceFileReader invoiceFileReader,
                                StatementsProperties properties,
                                Clock clock) {
        this.invoiceFileRepository = invoiceFileRepository;
        this.invoiceFileReader = invoiceFileReader;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Invoice rows loaded from one export.
     */
    public record InvoiceSnapshot(String reference, String filename, List<InvoiceLineItem> rows) {}

    /**
     * Reference of the snapshot new work should use, empty when no invoices are available.
     */
    @Transactional(readOnly = true)
    public Optional<String> currentReference() {
        StatementsProperties.Invoices invoices = properties.getInvoices();
        if (invoices.getSource() == Source.PATH) {
            if (invoices.getPath() == null || invoices.getPath().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(PATH_PREFIX + Paths.get(invoices.getPath()).toAbsolutePath().normalize());
        }
        return invoiceFileRepository.findTopByOrderByUploadedAtDescIdDesc()
            .map(file -> FILE_PREFIX + file.getId());
    }

    /**
     * Loads the current snapshot.
     *
     * @throws SnapshotUnavailableException if there is no invoice source
     */
    @Transactional(readOnly = true)
    public InvoiceSnapshot loadCurrent() {
        String reference = currentReference()
            .orElseThrow(() -> new SnapshotUnavailableException("No invoice file has been uploaded"));
        return load(reference);
    }

    /**
     * Loads the snapshot a reference points to.
     *
     * @throws SnapshotUnavailableException if the reference is unknown or its file is gone
     * @throws InvoiceValidationException if the file exists but is not a valid export
     */
    @Transactional(readOnly = true)
    public InvoiceSnapshot load(String reference) {
        Path path = resolvePath(reference);
        if (!Files.isReadable(path)) {
            throw new SnapshotUnavailableException("Invoice file not found: " + path);
        }
        List<InvoiceLineItem> rows = invoiceFileReader.read(path);
        log.debug("Loaded {} invoice rows from {}", rows.size(), reference);
        return new InvoiceSnapshot(reference, path.getFileName().toString(), rows);
    }

    /**
     * Stores an uploaded export in the upload directory and registers it as the latest
     * invoice file. The file is validated first; an invalid upload is not kept.
     */
    @Transactional
    public InvoiceFile registerUpload(String originalFilename, InputStream content) throws IOException {
        String safeName = Paths.get(originalFilename).getFileName().toString().replaceAll("[^A-Za-z0-9._-]", "_");
        Path dir = Paths.get(properties.getInvoices().getUploadDir());
        Files.createDirectories(dir);
        Path target = dir.resolve(LocalDateTime.now(clock).format(UPLOAD_STAMP) + "_" + safeName)
            .toAbsolutePath().normalize();
        Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);

        try {
            invoiceFileReader.read(target);
        } catch (InvoiceValidationException e) {
            Files.deleteIfExists(target);
            throw e;
        }

        InvoiceFile file = invoiceFileRepository.save(new InvoiceFile(originalFilename, target.toString()));
        log.info("Registered invoice upload {} as {}{}", originalFilename, FILE_PREFIX, file.getId());
        return file;
    }

    // Helper methods

    private Path resolvePath(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new SnapshotUnavailableException("Job has no invoice reference");
        }
        if (reference.startsWith(PATH_PREFIX)) {
            return Paths.get(reference.substring(PATH_PREFIX.length()));
        }
        if (reference.startsWith(FILE_PREFIX)) {
            long id;
            try {
                id = Long.parseLong(reference.substring(FILE_PREFIX.length()));
            } catch (NumberFormatException e) {
                throw new SnapshotUnavailableException("Malformed invoice reference: " + reference, e);
            }
            InvoiceFile file = invoiceFileRepository.findById(id)
                .orElseThrow(() -> new SnapshotUnavailableException("Invoice file " + reference + " no longer exists"));
            return Paths.get(file.getPath());
        }
        throw new SnapshotUnavailableException("Unknown invoice reference: " + reference);
    }
}
