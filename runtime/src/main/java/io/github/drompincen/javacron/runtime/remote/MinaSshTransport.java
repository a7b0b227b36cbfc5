package io.github.drompincen.javacron.runtime.remote;

import io.github.drompincen.javacron.protocol.api.AuthKind;
import jakarta.annotation.PreDestroy;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.config.keys.FilePasswordProvider;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.apache.sshd.core.CoreModuleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.time.Duration;

/**
 * SSH transport on Apache MINA SSHD. One shared client; each {@link #connect} yields an
 * independent authenticated session.
 */
@Component
public class MinaSshTransport implements RemoteTransport {

    private static final Logger log = LoggerFactory.getLogger(MinaSshTransport.class);

    private final SshClient client;

    public MinaSshTransport(@Value("${javacron.remote.keepalive-interval-ms:10000}") long keepaliveIntervalMs) {
        this.client = SshClient.setUpDefaultClient();
        // Hosts are registered by their owners; there is no known_hosts store to check against.
        client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
        CoreModuleProperties.HEARTBEAT_INTERVAL.set(client, Duration.ofMillis(keepaliveIntervalMs));
        client.start();
    }

    @Override
    public RemoteSession connect(RemoteTarget target, Duration connectTimeout) {
        ClientSession session = null;
        try {
            session = client.connect(target.user(), target.host(), target.port())
                    .verify(connectTimeout.toMillis())
                    .getSession();
            if (target.authKind() == AuthKind.PASSWORD) {
                session.addPasswordIdentity(target.credential());
            } else {
                for (KeyPair keyPair : loadKeys(session, target)) {
                    session.addPublicKeyIdentity(keyPair);
                }
            }
            session.auth().verify(connectTimeout.toMillis());
            log.debug("Authenticated {} using {}", target.key(), target.authKind());
            return new MinaSshSession(session);
        } catch (IOException | GeneralSecurityException | RuntimeException e) {
            if (session != null) {
                session.close(true);
            }
            throw ConnectionFailureClassifier.toException(target.key(), e);
        }
    }

    private Iterable<KeyPair> loadKeys(ClientSession session, RemoteTarget target)
            throws IOException, GeneralSecurityException {
        if (target.credential() == null || target.credential().isBlank()) {
            throw new RemoteConnectionException(ConnectionFailure.AUTH_FAILED,
                    "No private key configured for " + target.key());
        }
        try (InputStream in = new ByteArrayInputStream(target.credential().getBytes(StandardCharsets.UTF_8))) {
            Iterable<KeyPair> keys = SecurityUtils.loadKeyPairIdentities(session,
                    NamedResource.ofName(target.key().toString()), in, FilePasswordProvider.EMPTY);
            if (keys == null) {
                throw new RemoteConnectionException(ConnectionFailure.AUTH_FAILED,
                        "Private key for " + target.key() + " could not be parsed");
            }
            return keys;
        }
    }

    @PreDestroy
    public void stop() {
        client.stop();
    }
}
