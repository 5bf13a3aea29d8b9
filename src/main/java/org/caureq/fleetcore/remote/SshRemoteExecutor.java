package org.caureq.fleetcore.remote;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import net.schmizz.sshj.SSHClient;
import net.schmizz.sshj.common.IOUtils;
import net.schmizz.sshj.common.SecurityUtils;
import net.schmizz.sshj.connection.channel.direct.Session;
import net.schmizz.sshj.transport.TransportException;
import net.schmizz.sshj.userauth.UserAuthException;
import net.schmizz.sshj.transport.verification.HostKeyVerifier;
import net.schmizz.sshj.userauth.keyprovider.KeyProvider;
import net.schmizz.sshj.userauth.password.PasswordFinder;
import org.caureq.fleetcore.config.FleetProps;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;

/**
 * sshj-backed executor. One connection per call; the whole call (connect, auth, run, drain)
 * is bounded by the caller's timeout and the connection is torn down when it expires.
 */
@Component
@Slf4j
public class SshRemoteExecutor implements RemoteExecutor {
    private final FleetProps props;
    private final HostKeyRegistry hostKeys;
    private final ExecutorService io = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ssh-io");
        t.setDaemon(true);
        return t;
    });

    public SshRemoteExecutor(FleetProps props, HostKeyRegistry hostKeys) {
        this.props = props;
        this.hostKeys = hostKeys;
    }

    @Override
    public ExecResult exec(RemoteTarget target, String command, Duration timeout) {
        long t0 = System.currentTimeMillis();
        return withClient(target, timeout, ssh -> {
            try (Session session = ssh.startSession()) {
                Session.Command cmd = session.exec(command);
                String out = IOUtils.readFully(cmd.getInputStream()).toString(StandardCharsets.UTF_8);
                String err = IOUtils.readFully(cmd.getErrorStream()).toString(StandardCharsets.UTF_8);
                cmd.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
                Integer exit = cmd.getExitStatus();
                long took = System.currentTimeMillis() - t0;
                log.debug("[SSH] {} exit={} in {}ms", target.endpoint(), exit, took);
                return new ExecResult(exit == null ? -1 : exit, out, err, took);
            }
        });
    }

    @Override
    public void upload(RemoteTarget target, byte[] content, String remotePath, Duration timeout) {
        ExecResult r = withClient(target, timeout, ssh -> {
            try (Session session = ssh.startSession()) {
                Session.Command cmd = session.exec("cat > '" + remotePath.replace("'", "'\\''") + "'");
                try (OutputStream stdin = cmd.getOutputStream()) {
                    stdin.write(content);
                    stdin.flush();
                }
                String err = IOUtils.readFully(cmd.getErrorStream()).toString(StandardCharsets.UTF_8);
                cmd.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
                Integer exit = cmd.getExitStatus();
                return new ExecResult(exit == null ? -1 : exit, "", err, 0);
            }
        });
        if (!r.ok()) {
            throw new ConnectivityException(ConnectivityException.Kind.PROTOCOL, target.host(),
                    "upload to " + remotePath + " failed (exit " + r.exitCode() + "): " + r.tail());
        }
    }

    @PreDestroy
    void shutdown() {
        io.shutdownNow();
    }

    private interface SshCall {
        ExecResult run(SSHClient ssh) throws IOException;
    }

    private ExecResult withClient(RemoteTarget target, Duration timeout, SshCall call) {
        SSHClient ssh = new SSHClient();
        Future<ExecResult> f = io.submit(() -> {
            connect(ssh, target);
            return call.run(ssh);
        });
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new ConnectivityException(ConnectivityException.Kind.TIMEOUT, target.host(),
                    "timed out after " + timeout.toSeconds() + "s on " + target.endpoint());
        } catch (ExecutionException e) {
            throw classify(target, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException(ConnectivityException.Kind.TIMEOUT, target.host(), "interrupted", e);
        } finally {
            closeQuietly(ssh);
        }
    }

    private void connect(SSHClient ssh, RemoteTarget target) throws IOException {
        int connectMs = (int) props.remote().connectTimeout().toMillis();
        ssh.setConnectTimeout(connectMs);
        ssh.setTimeout(connectMs);
        ssh.addHostKeyVerifier(new HostKeyVerifier() {
            @Override
            public boolean verify(String hostname, int port, PublicKey key) {
                return hostKeys.verify(hostname, port, SecurityUtils.getFingerprint(key));
            }

            @Override
            public List<String> findExistingAlgorithms(String hostname, int port) {
                return List.of();
            }
        });
        ssh.connect(target.host(), target.port());
        if (target.hasKey()) {
            KeyProvider keys = ssh.loadKeys(target.privateKey(), (String) null, (PasswordFinder) null);
            ssh.authPublickey(target.username(), keys);
        } else if (target.hasPassword()) {
            ssh.authPassword(target.username(), target.password());
        } else {
            throw new UserAuthException("no password or private key for " + target.username());
        }
    }

    private ConnectivityException classify(RemoteTarget target, Throwable t) {
        if (t instanceof ConnectivityException ce) return ce;
        String host = target.host();
        String msg = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        if (t instanceof UserAuthException) {
            return new ConnectivityException(ConnectivityException.Kind.AUTH_FAILED, host,
                    "authentication failed for " + target.username() + "@" + target.endpoint(), t);
        }
        if (t instanceof SocketTimeoutException) {
            return new ConnectivityException(ConnectivityException.Kind.TIMEOUT, host, "connect timed out: " + target.endpoint(), t);
        }
        if (t instanceof ConnectException || t instanceof NoRouteToHostException || t instanceof UnknownHostException) {
            return new ConnectivityException(ConnectivityException.Kind.UNREACHABLE, host, "unreachable: " + target.endpoint() + " (" + msg + ")", t);
        }
        if (t instanceof TransportException) {
            return new ConnectivityException(ConnectivityException.Kind.PROTOCOL, host, "ssh transport error: " + msg, t);
        }
        return new ConnectivityException(ConnectivityException.Kind.UNREACHABLE, host, msg, t);
    }

    private void closeQuietly(SSHClient ssh) {
        try {
            if (ssh.isConnected()) ssh.disconnect();
        } catch (IOException e) {
            log.debug("[SSH] disconnect failed: {}", e.getMessage());
        }
    }
}
