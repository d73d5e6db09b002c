package tech.authkit.sdk;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.authkit.config.ProviderConfiguration;
import tech.authkit.http.HttpTransport;
import tech.authkit.http.JdkHttpTransport;
import tech.authkit.redirect.DesktopBrowserLauncher;
import tech.authkit.redirect.InteractiveRedirect;
import tech.authkit.redirect.LoopbackRedirect;
import tech.authkit.role.DefaultRole;
import tech.authkit.sdk.config.AuthKitConfig;
import tech.authkit.sdk.config.AuthKitConfigs;
import tech.authkit.session.AuthSession;
import tech.authkit.store.CredentialStore;
import tech.authkit.store.FileCredentialStore;
import tech.authkit.store.InMemoryCredentialStore;

import java.nio.file.Path;
import java.time.Duration;

/**
 * CDI producer that wires AuthKit from {@link AuthKitConfig}.
 */
@ApplicationScoped
public class AuthKitProducer {

    private static final Logger LOG = Logger.getLogger(AuthKitProducer.class);

    @Inject
    AuthKitConfig config;

    public AuthKitProducer() {
    }

    AuthKitProducer(AuthKitConfig config) {
        this.config = config;
    }

    // Records are final and cannot be proxied, so no normal scope here
    @Produces
    @Singleton
    public ProviderConfiguration providerConfiguration() {
        return AuthKitConfigs.toProviderConfiguration(config);
    }

    @Produces
    @ApplicationScoped
    public HttpTransport httpTransport() {
        AuthKitConfig.HttpConfig http = config.http();
        return new JdkHttpTransport(Duration.ofSeconds(http.connectTimeout()), Duration.ofSeconds(http.timeout()));
    }

    @Produces
    @ApplicationScoped
    public CredentialStore credentialStore() {
        CredentialStore.StoreType type = config.store().type();
        LOG.infof("Initializing credential store: type=%s", type);

        return switch (type) {
            case MEMORY -> {
                LOG.info("Using in-memory credential store, sessions will not survive a restart");
                yield new InMemoryCredentialStore();
            }
            case FILE -> {
                FileCredentialStore store = config.store().path()
                    .map(path -> new FileCredentialStore(Path.of(path)))
                    .orElseGet(FileCredentialStore::inUserHome);
                LOG.infof("Using credential file %s", store.getFile());
                yield store;
            }
        };
    }

    @Produces
    @ApplicationScoped
    public InteractiveRedirect interactiveRedirect() {
        if (config.redirect().openBrowser()) {
            return new LoopbackRedirect(new DesktopBrowserLauncher());
        }
        return new LoopbackRedirect(url -> LOG.infof("Open this URL to sign in: %s", url));
    }

    @Produces
    @Singleton
    public AuthSession<DefaultRole> authSession(CredentialStore credentialStore,
                                                InteractiveRedirect interactiveRedirect,
                                                HttpTransport transport) {
        return AuthSession.builder(DefaultRole.MODEL)
            .credentialStore(credentialStore)
            .interactiveRedirect(interactiveRedirect)
            .transport(transport)
            .redirectTimeout(config.redirect().timeout())
            .build();
    }

    public void closeAuthSession(@Disposes AuthSession<DefaultRole> session) {
        LOG.debug("Closing auth session");
        session.close();
    }
}
