package org.caureq.fleetcore.remote;

import java.time.Duration;

/**
 * Runs commands on a remote host. Implementations must honour the timeout as a hard limit
 * and report transport problems as {@link ConnectivityException}. A command that ran and
 * exited non-zero is not an exception: it comes back in the {@link ExecResult}.
 */
public interface RemoteExecutor {

    ExecResult exec(RemoteTarget target, String command, Duration timeout);

    void upload(RemoteTarget target, byte[] content, String remotePath, Duration timeout);
}
