package tech.authkit.redirect;

import java.io.IOException;
import java.net.URI;

/**
 * Opens a URL for the user.
 */
@FunctionalInterface
public interface BrowserLauncher {

    void open(URI uri) throws IOException;
}
