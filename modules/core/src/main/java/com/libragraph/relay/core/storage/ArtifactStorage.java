package com.libragraph.relay.core.storage;

import com.libragraph.relay.core.job.Job;
import com.libragraph.relay.util.JobIds;
import com.libragraph.relay.util.MediaTypes;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Filesystem owner of job artifacts.
 *
 * <p>Uploads are written once into the backend's input directory as
 * {@code td_input_{jobId}_{epochMillis}{ext}}; the job id in the name is what
 * ties a file to its job, no locking is involved. Results are written by the
 * backend and only read and deleted here.
 */
@ApplicationScoped
public class ArtifactStorage {

    private static final Logger log = Logger.getLogger(ArtifactStorage.class);

    private static final String DEFAULT_EXTENSION = ".png";
    private static final Pattern SAFE_EXTENSION = Pattern.compile("\\.[a-z0-9]{1,10}");

    @ConfigProperty(name = "relay.storage.input-dir")
    String inputDir;

    public ArtifactStorage() {
    }

    ArtifactStorage(Path inputRoot) {
        this.inputDir = inputRoot.toString();
    }

    /**
     * Copies an uploaded image into the input directory.
     *
     * @param originalName client-supplied filename, used only for its extension
     * @return absolute path of the stored file
     * @throws StorageException on I/O errors
     */
    public Path saveUpload(String jobId, String originalName, InputStream content) {
        JobIds.requireWellFormed(jobId);
        Path target = inputRoot().resolve(
                "td_input_" + jobId + "_" + System.currentTimeMillis() + extensionOf(originalName));
        try {
            Files.createDirectories(target.getParent());
            long size = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            log.infof("Saved input image: %s (%d bytes)", target, size);
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to save input image for job " + jobId, e);
        }
    }

    /** Same as {@link #saveUpload(String, String, InputStream)} for an upload already spooled to disk. */
    public Path saveUpload(String jobId, String originalName, Path spooled) {
        try (InputStream in = Files.newInputStream(spooled)) {
            return saveUpload(jobId, originalName, in);
        } catch (IOException e) {
            throw new StorageException("Failed to read uploaded file for job " + jobId, e);
        }
    }

    /**
     * Deletes the job's input and result files if they exist.
     *
     * @throws StorageException if a file exists but cannot be deleted
     */
    public void deleteOwnedFiles(Job job) {
        deleteIfPresent(job.inputPath(), job.id());
        deleteIfPresent(job.resultPath(), job.id());
    }

    /** The job's result file, when the job has one and it is still on disk. */
    public Optional<Path> resultFile(Job job) {
        if (job.resultPath() == null) {
            return Optional.empty();
        }
        Path path = Path.of(job.resultPath());
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    Path inputRoot() {
        return Path.of(inputDir).toAbsolutePath().normalize();
    }

    static String extensionOf(String originalName) {
        String ext = MediaTypes.extension(originalName);
        return SAFE_EXTENSION.matcher(ext).matches() ? ext : DEFAULT_EXTENSION;
    }

    private void deleteIfPresent(String file, String jobId) {
        if (file == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(Path.of(file))) {
                log.debugf("Deleted %s (job %s)", file, jobId);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + file + " for job " + jobId, e);
        }
    }
}
