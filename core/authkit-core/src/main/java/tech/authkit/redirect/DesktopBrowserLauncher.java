package tech.authkit.redirect;

import org.jboss.logging.Logger;

import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;

/**
 * Opens URLs in the system browser.
 *
 * <p>Uses {@link Desktop} when the platform supports it and falls back to the
 * usual OS commands ({@code open}, {@code rundll32}, {@code xdg-open}).
 */
public class DesktopBrowserLauncher implements BrowserLauncher {

    private static final Logger LOG = Logger.getLogger(DesktopBrowserLauncher.class);

    @Override
    public void open(URI uri) throws IOException {
        if (!java.awt.GraphicsEnvironment.isHeadless()
            && Desktop.isDesktopSupported()
            && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            Desktop.getDesktop().browse(uri);
            return;
        }

        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        String[] command;
        if (os.contains("mac")) {
            command = new String[]{"open", uri.toString()};
        } else if (os.contains("win")) {
            command = new String[]{"rundll32", "url.dll,FileProtocolHandler", uri.toString()};
        } else {
            command = new String[]{"xdg-open", uri.toString()};
        }
        LOG.debugf("Desktop browsing unavailable, launching %s", command[0]);
        new ProcessBuilder(command).inheritIO().start();
    }
}
