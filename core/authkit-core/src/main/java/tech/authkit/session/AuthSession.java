package tech.authkit.session;

import org.jboss.logging.Logger;
import tech.authkit.config.ProviderConfiguration;
import tech.authkit.exception.AuthErrorKind;
import tech.authkit.exception.AuthKitException;
import tech.authkit.exception.AuthorizationException;
import tech.authkit.http.HttpTransport;
import tech.authkit.http.JdkHttpTransport;
import tech.authkit.identity.IdentityDecoder;
import tech.authkit.redirect.InteractiveRedirect;
import tech.authkit.redirect.LoopbackRedirect;
import tech.authkit.redirect.RedirectCoordinator;
import tech.authkit.role.RoleMapper;
import tech.authkit.role.RoleModel;
import tech.authkit.store.CredentialStore;
import tech.authkit.store.InMemoryCredentialStore;
import tech.authkit.store.SessionRecordRepository;
import tech.authkit.token.TokenExchanger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the authentication state of one user and drives the login flow.
 *
 * <p>On construction the session restores any record left in the
 * {@link CredentialStore} by a previous run, without touching the network.
 * {@link #login} then runs, strictly in sequence:
 * <ol>
 *   <li>interactive authorization ({@link RedirectCoordinator})</li>
 *   <li>code-for-token exchange ({@link TokenExchanger})</li>
 *   <li>identity resolution ({@link IdentityDecoder})</li>
 *   <li>the caller's {@link RoleMapper}</li>
 * </ol>
 * and persists the token and role on success.
 *
 * <p>State lives in an immutable {@link SessionState} replaced under the
 * session's monitor; listeners see every replacement in order. Every login
 * attempt publishes exactly one terminal state ({@code AUTHENTICATED} or
 * {@code FAILED}) with {@code loading == false}. A failed attempt never logs
 * the user out; only {@link #logout()} does.
 *
 * <p>Example:
 * <pre>{@code
 * AuthSession<DefaultRole> session = AuthSession.builder(DefaultRole.MODEL)
 *     .credentialStore(FileCredentialStore.inUserHome())
 *     .build();
 *
 * session.login(google, JsonClaimsRoleMapper.of(claims ->
 *         claims.path("email").asText("").endsWith("@example.com") ? DefaultRole.ADMIN : DefaultRole.USER))
 *     .thenAccept(state -> System.out.println(state.loggedIn() ? "Welcome" : state.lastError()));
 * }</pre>
 *
 * @param <R> the application's role type
 */
public class AuthSession<R> implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(AuthSession.class);

    public static final String ROLE_MAPPING_FAILED_MESSAGE = "Could not map user data to a role";
    public static final String SESSION_CLOSED_MESSAGE = "Login cancelled: session closed";

    private final RoleModel<R> roleModel;
    private final SessionRecordRepository<R> records;
    private final RedirectCoordinator redirectCoordinator;
    private final TokenExchanger tokenExchanger;
    private final IdentityDecoder identityDecoder;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final List<SessionListener<R>> listeners = new CopyOnWriteArrayList<>();

    private volatile SessionState<R> state;
    private String accessToken;
    private CompletableFuture<SessionState<R>> inFlight;
    private CompletableFuture<String> pendingAuthorization;
    private boolean closed;

    /**
     * @param executor runs the token exchange, identity resolution and role mapping;
     *                 the caller keeps ownership of it
     */
    public AuthSession(RoleModel<R> roleModel,
                       CredentialStore credentialStore,
                       RedirectCoordinator redirectCoordinator,
                       TokenExchanger tokenExchanger,
                       IdentityDecoder identityDecoder,
                       Executor executor) {
        this(roleModel, credentialStore, redirectCoordinator, tokenExchanger, identityDecoder, executor, null);
    }

    private AuthSession(RoleModel<R> roleModel,
                        CredentialStore credentialStore,
                        RedirectCoordinator redirectCoordinator,
                        TokenExchanger tokenExchanger,
                        IdentityDecoder identityDecoder,
                        Executor executor,
                        ExecutorService ownedExecutor) {
        this.roleModel = Objects.requireNonNull(roleModel, "roleModel");
        this.records = new SessionRecordRepository<>(Objects.requireNonNull(credentialStore, "credentialStore"), roleModel);
        this.redirectCoordinator = Objects.requireNonNull(redirectCoordinator, "redirectCoordinator");
        this.tokenExchanger = Objects.requireNonNull(tokenExchanger, "tokenExchanger");
        this.identityDecoder = Objects.requireNonNull(identityDecoder, "identityDecoder");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownedExecutor = ownedExecutor;
        this.state = SessionState.initial(roleModel.guest());
        restoreSession();
    }

    public static <R> Builder<R> builder(RoleModel<R> roleModel) {
        return new Builder<>(roleModel);
    }

    // ==================== Restoration ====================

    private void restoreSession() {
        Optional<String> token;
        try {
            token = records.findToken();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not read stored session, starting logged out");
            return;
        }
        if (token.isEmpty()) {
            LOG.debug("No stored session");
            return;
        }

        R role = roleModel.guest();
        try {
            Optional<R> storedRole = records.findRole();
            if (storedRole.isPresent()) {
                role = storedRole.get();
            } else {
                LOG.info("Stored session has no readable role, continuing as guest");
            }
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not read stored role, continuing as guest");
        }

        synchronized (this) {
            accessToken = token.get();
            state = SessionState.restored(role);
        }
        LOG.infof("Restored session with role %s", role);
    }

    // ==================== Login ====================

    /**
     * Run the full login flow.
     *
     * <p>{@code loading} is published before this method returns. The returned
     * future completes with the terminal state and never completes exceptionally;
     * failures are reported through {@link SessionState#lastError()}.
     *
     * <p>While an attempt is running, further calls do not start another one:
     * they return the running attempt's future and their arguments are ignored.
     * Closing the session ends a running attempt with {@code AUTHORIZATION_CANCELLED}.
     *
     * @throws IllegalStateException if the session has been closed
     */
    public CompletableFuture<SessionState<R>> login(ProviderConfiguration config, RoleMapper<R> roleMapper) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(roleMapper, "roleMapper");

        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("AuthSession is closed");
            }
            if (inFlight != null) {
                LOG.warn("Login already in progress, joining the running attempt");
                return inFlight;
            }

            LOG.infof("Login started for client %s", config.clientId());
            publish(state.loginStarted());

            CompletableFuture<String> authorization = redirectCoordinator.beginAuthorization(config);
            Executor stages = this::runStage;
            CompletableFuture<SessionState<R>> attempt = authorization
                .thenApplyAsync(code -> {
                    enterPhase(AuthPhase.EXCHANGING_CODE);
                    return tokenExchanger.exchange(config, code);
                }, stages)
                .thenApplyAsync(tokens -> {
                    enterPhase(AuthPhase.RESOLVING_IDENTITY);
                    return new ResolvedIdentity(tokens.accessToken(), identityDecoder.resolveIdentity(config, tokens));
                }, stages)
                .handleAsync((identity, error) -> finish(identity, error, roleMapper), stages);

            // A synchronous executor may already have finished the attempt
            if (!attempt.isDone()) {
                inFlight = attempt;
                pendingAuthorization = authorization;
            }
            return attempt;
        }
    }

    /**
     * Stages fall back to the completing thread once the executor stops taking
     * work, so the terminal state is always published.
     */
    private void runStage(Runnable stage) {
        try {
            executor.execute(stage);
        } catch (RejectedExecutionException e) {
            LOG.debug("Executor rejected a login stage, running it on the calling thread");
            stage.run();
        }
    }

    private synchronized void enterPhase(AuthPhase phase) {
        if (closed) {
            throw AuthorizationException.cancelled("session closed");
        }
        publish(state.inPhase(phase));
    }

    private synchronized SessionState<R> finish(ResolvedIdentity identity, Throwable error, RoleMapper<R> roleMapper) {
        if (closed && inFlight == null) {
            // close() already published the terminal state for this attempt
            return state;
        }
        try {
            if (error != null) {
                AuthKitException failure = toFailure(unwrap(error));
                LOG.warnf("Login failed (%s): %s", failure.getKind(), failure.getMessage());
                return publish(state.failed(failure.getKind(), failure.getMessage()));
            }

            Optional<R> role = mapRole(roleMapper, identity.payload());
            if (role.isEmpty()) {
                LOG.warn("Login failed: role mapper returned no role");
                return publish(state.failed(AuthErrorKind.ROLE_MAPPING_FAILED, ROLE_MAPPING_FAILED_MESSAGE));
            }

            try {
                records.save(identity.accessToken(), role.get());
            } catch (RuntimeException e) {
                LOG.errorf(e, "Could not persist session, it will not survive a restart");
            }

            LOG.infof("Login succeeded with role %s", role.get());
            accessToken = identity.accessToken();
            return publish(state.authenticated(role.get()));
        } catch (RuntimeException e) {
            AuthKitException failure = toFailure(e);
            LOG.errorf(e, "Login failed unexpectedly");
            return publish(state.failed(failure.getKind(), failure.getMessage()));
        } finally {
            inFlight = null;
            pendingAuthorization = null;
        }
    }

    private Optional<R> mapRole(RoleMapper<R> roleMapper, byte[] payload) {
        try {
            Optional<R> role = roleMapper.map(payload);
            return role != null ? role : Optional.empty();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Role mapper threw");
            return Optional.empty();
        }
    }

    private AuthKitException toFailure(Throwable error) {
        if (error instanceof AuthKitException authKitException) {
            return authKitException;
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new AuthKitException(AuthErrorKind.UNEXPECTED, "Login failed: " + detail, error);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    // ==================== Logout ====================

    /**
     * Forget the user: clears the token, resets the role to guest and deletes
     * the persisted record. Safe to call repeatedly.
     */
    public synchronized void logout() {
        try {
            records.clear();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not delete persisted session");
        }
        accessToken = null;
        publish(state.loggedOut(roleModel.guest()));
        LOG.info("Logged out");
    }

    // ==================== Queries ====================

    public SessionState<R> state() {
        return state;
    }

    public boolean isLoggedIn() {
        return state.loggedIn();
    }

    public boolean isLoading() {
        return state.loading();
    }

    public R currentRole() {
        return state.role();
    }

    public boolean hasRole(R target) {
        return Objects.equals(state.role(), target);
    }

    public boolean hasAnyRole(Set<R> roles) {
        return roles.contains(state.role());
    }

    synchronized String accessToken() {
        return accessToken;
    }

    // ==================== Listeners ====================

    public void addListener(SessionListener<R> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SessionListener<R> listener) {
        listeners.remove(listener);
    }

    private SessionState<R> publish(SessionState<R> next) {
        state = next;
        for (SessionListener<R> listener : listeners) {
            try {
                listener.onStateChanged(next);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Session listener %s failed", listener);
            }
        }
        return next;
    }

    /**
     * Stop accepting logins. A running attempt ends with
     * {@code AUTHORIZATION_CANCELLED} and its future completes normally; work
     * still running for it is discarded.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (inFlight != null) {
            CompletableFuture<SessionState<R>> attempt = inFlight;
            CompletableFuture<String> authorization = pendingAuthorization;
            inFlight = null;
            pendingAuthorization = null;

            LOG.warn("Session closed during login, cancelling the running attempt");
            SessionState<R> cancelled = publish(state.failed(AuthErrorKind.AUTHORIZATION_CANCELLED, SESSION_CLOSED_MESSAGE));
            attempt.complete(cancelled);
            if (authorization != null) {
                authorization.completeExceptionally(AuthorizationException.cancelled("session closed"));
            }
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private record ResolvedIdentity(String accessToken, byte[] payload) {}

    // ==================== Builder ====================

    public static final class Builder<R> {

        private final RoleModel<R> roleModel;
        private CredentialStore credentialStore;
        private InteractiveRedirect interactiveRedirect;
        private HttpTransport transport;
        private Duration redirectTimeout = Duration.ofMinutes(5);
        private Executor executor;

        private Builder(RoleModel<R> roleModel) {
            this.roleModel = Objects.requireNonNull(roleModel, "roleModel");
        }

        /**
         * Where the session is persisted. Defaults to an in-memory store.
         */
        public Builder<R> credentialStore(CredentialStore credentialStore) {
            this.credentialStore = credentialStore;
            return this;
        }

        /**
         * How the authorization page is shown. Defaults to {@link LoopbackRedirect}.
         */
        public Builder<R> interactiveRedirect(InteractiveRedirect interactiveRedirect) {
            this.interactiveRedirect = interactiveRedirect;
            return this;
        }

        /**
         * HTTP client for the token and userinfo endpoints. Defaults to {@link JdkHttpTransport}.
         */
        public Builder<R> transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Upper bound for the interactive step; {@code null} or zero waits forever.
         */
        public Builder<R> redirectTimeout(Duration redirectTimeout) {
            this.redirectTimeout = redirectTimeout;
            return this;
        }

        /**
         * Executor for the network stages. Defaults to a single daemon thread
         * owned and shut down by the session.
         */
        public Builder<R> executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public AuthSession<R> build() {
            HttpTransport http = transport != null ? transport : new JdkHttpTransport();
            ExecutorService owned = null;
            Executor stages = executor;
            if (stages == null) {
                owned = Executors.newSingleThreadExecutor(runnable -> {
                    Thread thread = new Thread(runnable, "authkit-login");
                    thread.setDaemon(true);
                    return thread;
                });
                stages = owned;
            }

            return new AuthSession<>(
                roleModel,
                credentialStore != null ? credentialStore : new InMemoryCredentialStore(),
                new RedirectCoordinator(
                    interactiveRedirect != null ? interactiveRedirect : new LoopbackRedirect(),
                    redirectTimeout),
                new TokenExchanger(http),
                new IdentityDecoder(http),
                stages,
                owned
            );
        }
    }
}
