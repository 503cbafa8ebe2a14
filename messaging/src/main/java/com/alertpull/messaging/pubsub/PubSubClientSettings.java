/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.pubsub;

import com.alertpull.common.exception.ConfigurationException;
import com.alertpull.common.model.BrokerConfig;
import com.google.api.gax.core.CredentialsProvider;
import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.gax.core.NoCredentialsProvider;
import com.google.api.gax.grpc.GrpcTransportChannel;
import com.google.api.gax.rpc.FixedTransportChannelProvider;
import com.google.api.gax.rpc.TransportChannelProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.pubsub.v1.SubscriptionAdminSettings;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.TimeUnit;

/**
 * Shared client wiring for the Pub/Sub subscriber and admin clients: which project,
 * which credentials, and (for the emulator) which plaintext channel.
 *
 * <p>Credentials are resolved here, before any stream is built. An explicit
 * {@link CredentialsProvider} wins; otherwise the emulator uses no credentials, a
 * configured service-account file is loaded, and failing both the application default
 * credentials are used.</p>
 */
public class PubSubClientSettings implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PubSubClientSettings.class);

    private final String projectId;
    private final String topicProjectId;
    private final CredentialsProvider credentialsProvider;
    private final ManagedChannel emulatorChannel;
    private final TransportChannelProvider channelProvider;

    public PubSubClientSettings(BrokerConfig config, CredentialsProvider credentialsOverride) {
        if (config.getProjectId() == null || config.getProjectId().isBlank()) {
            throw new ConfigurationException("Pub/Sub broker requires a project_id");
        }
        this.projectId = config.getProjectId();
        this.topicProjectId = config.resolveTopicProjectId();

        String emulatorHost = config.getEmulatorHost();
        if (emulatorHost != null && !emulatorHost.isBlank()) {
            this.emulatorChannel = ManagedChannelBuilder.forTarget(emulatorHost).usePlaintext().build();
            this.channelProvider = FixedTransportChannelProvider.create(GrpcTransportChannel.create(emulatorChannel));
            log.info("Pub/Sub client using emulator at {}", emulatorHost);
        } else {
            this.emulatorChannel = null;
            this.channelProvider = null;
        }
        this.credentialsProvider = credentialsOverride != null
                ? credentialsOverride
                : resolveCredentials(config, emulatorChannel != null);
    }

    private static CredentialsProvider resolveCredentials(BrokerConfig config, boolean emulator) {
        if (emulator) {
            return NoCredentialsProvider.create();
        }
        String file = config.getCredentialsFile();
        if (file != null && !file.isBlank()) {
            try (InputStream in = new FileInputStream(file)) {
                log.info("Pub/Sub client using service account credentials from {}", file);
                return FixedCredentialsProvider.create(GoogleCredentials.fromStream(in));
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read Pub/Sub credentials file " + file, e);
            }
        }
        return SubscriptionAdminSettings.defaultCredentialsProviderBuilder().build();
    }

    public String getProjectId() { return projectId; }
    public String getTopicProjectId() { return topicProjectId; }
    public CredentialsProvider getCredentialsProvider() { return credentialsProvider; }

    /** Plaintext channel to the emulator, or {@code null} to let the client build its own. */
    public TransportChannelProvider getChannelProvider() { return channelProvider; }

    @Override
    public void close() {
        if (emulatorChannel != null) {
            emulatorChannel.shutdown();
            try {
                if (!emulatorChannel.awaitTermination(5, TimeUnit.SECONDS)) {
                    emulatorChannel.shutdownNow();
                }
            } catch (InterruptedException e) {
                emulatorChannel.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
