package tech.authkit.store;

import org.jboss.logging.Logger;
import tech.authkit.exception.CredentialStoreException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Credential store backed by a {@link Properties} file.
 *
 * <p>Every write rewrites the whole file through a temporary file and an atomic
 * move. On POSIX file systems the file is restricted to {@code rw-------}.
 */
public class FileCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(FileCredentialStore.class);

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path file;

    public FileCredentialStore(Path file) {
        this.file = file;
    }

    /**
     * Store under {@code ~/.authkit/credentials.properties}.
     */
    public static FileCredentialStore inUserHome() {
        return new FileCredentialStore(Path.of(System.getProperty("user.home"), ".authkit", "credentials.properties"));
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void put(String key, String value) {
        Properties properties = load();
        properties.setProperty(key, value);
        write(properties);
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(load().getProperty(key));
    }

    @Override
    public synchronized void deleteAll() {
        try {
            if (Files.deleteIfExists(file)) {
                LOG.debugf("Deleted credential file %s", file);
            }
        } catch (IOException e) {
            throw CredentialStoreException.writeFailed(file, e);
        }
    }

    private Properties load() {
        Properties properties = new Properties();
        if (!Files.exists(file)) {
            return properties;
        }
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
            return properties;
        } catch (IOException e) {
            throw CredentialStoreException.readFailed(file, e);
        }
    }

    private void write(Properties properties) {
        try {
            Path directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);

            Path temp = Files.createTempFile(directory, ".credentials", ".tmp");
            restrictToOwner(temp);
            try (OutputStream out = Files.newOutputStream(temp)) {
                properties.store(out, "AuthKit credentials");
            }

            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw CredentialStoreException.writeFailed(file, e);
        }
    }

    private void restrictToOwner(Path path) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        }
    }
}
